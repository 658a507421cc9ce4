package com.buzz.mileage.domain.risk.repository;

import com.buzz.mileage.domain.risk.entity.SignupAttempt;
import com.buzz.mileage.domain.risk.entity.SignupAttemptStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SignupAttemptRepository extends JpaRepository<SignupAttempt, String> {

    List<SignupAttempt> findByEmailOrderByAttemptedAtDesc(String email);

    long countByStatus(SignupAttemptStatus status);
}
