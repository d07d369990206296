package org.mediacatalog.repository;

import org.mediacatalog.entity.Usr;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UsrRepository extends JpaRepository<Usr, Long> {
    Optional<Usr> findByUsername(String username); // Поиск пользователя по логину

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);
}
