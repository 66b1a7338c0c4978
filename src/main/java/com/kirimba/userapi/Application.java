package com.kirimba.userapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Главный класс Spring Boot приложения User API.
 * Поднимает контекст Spring: репозиторий, сервис, контроллеры и фильтры.
 */
@SpringBootApplication
public class Application {

    /**
     * Точка входа в приложение.
     *
     * @param args аргументы командной строки
     */
	public static void main(String[] args) {
		SpringApplication.run(Application.class, args);
	}

}
