package com.example.importservice.repository;

import com.example.importservice.entity.OAuthState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Bulk deletes are the consume primitive: a state is accepted only by the caller whose
 * delete reports one affected row.
 */
@Repository
public interface OAuthStateRepository extends JpaRepository<OAuthState, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OAuthState s WHERE s.stateToken = :stateToken AND s.expiresAt > :now")
    int deleteUnexpired(@Param("stateToken") String stateToken, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OAuthState s WHERE s.stateToken = :stateToken")
    int deleteByToken(@Param("stateToken") String stateToken);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OAuthState s WHERE s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
