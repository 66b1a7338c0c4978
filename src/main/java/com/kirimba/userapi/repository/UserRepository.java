package com.kirimba.userapi.repository;

import com.kirimba.userapi.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data репозиторий таблицы users.
 * Все значения передаются только через bind-параметры.
 */
public interface UserRepository extends JpaRepository<User, Integer> {

    @Transactional(readOnly = true)
    @Query(value = "SELECT id, name, dob, created_at, updated_at FROM users ORDER BY id LIMIT :limit OFFSET :offset",
            nativeQuery = true)
    List<User> findPage(@Param("limit") int limit, @Param("offset") long offset);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.name = :name, u.dateOfBirth = :dob, u.updatedAt = :updatedAt WHERE u.id = :id")
    int updateNameAndDateOfBirth(@Param("id") Integer id,
                                 @Param("name") String name,
                                 @Param("dob") LocalDate dateOfBirth,
                                 @Param("updatedAt") LocalDateTime updatedAt);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM User u WHERE u.id = :id")
    int deleteUserById(@Param("id") Integer id);
}
