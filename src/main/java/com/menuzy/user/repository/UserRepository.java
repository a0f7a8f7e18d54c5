package com.menuzy.user.repository;

import com.menuzy.user.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface UserRepository extends JpaRepository<User, Long> {

    boolean existsByEmail(String email);

    // Emails are stored normalized, so callers must pass normalized values.
    List<User> findByEmailIn(Collection<String> emails);
}
