package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.snapup_be.pojo.User;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByUsername(String username);
    boolean existsByUsername(String username);
}
