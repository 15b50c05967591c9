package com.example.importservice.repository;

import com.example.importservice.entity.OAuthCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OAuthCredentialRepository extends JpaRepository<OAuthCredential, Long> {

    Optional<OAuthCredential> findByAccountKey(String accountKey);
}
