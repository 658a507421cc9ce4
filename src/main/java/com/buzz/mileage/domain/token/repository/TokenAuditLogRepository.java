package com.buzz.mileage.domain.token.repository;

import com.buzz.mileage.domain.token.entity.TokenAuditAction;
import com.buzz.mileage.domain.token.entity.TokenAuditLog;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TokenAuditLogRepository extends JpaRepository<TokenAuditLog, String> {

    List<TokenAuditLog> findByTokenIdOrderByCreatedAtAsc(String tokenId);

    long countByTokenIdAndAction(String tokenId, TokenAuditAction action);
}
