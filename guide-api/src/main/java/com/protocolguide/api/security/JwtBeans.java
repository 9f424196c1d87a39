package com.protocolguide.api.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Verification side only: tokens are minted by the account service with the shared HS256 secret.
 */
@Configuration
public class JwtBeans {

  private static final Logger log = LoggerFactory.getLogger(JwtBeans.class);

  static final String DEV_SECRET = "dev-secret-change-me";

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(@Value("${guide.auth.jwt-secret:}") String secret,
                               @Value("${guide.auth.issuer:}") String issuer) {
    var key = new SecretKeySpec(deriveKey(secret), "HmacSHA256");
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    if (issuer != null && !issuer.isBlank()) {
      decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(issuer.trim()));
    }
    return decoder;
  }

  /**
   * Key = SHA-256 of the configured string, so any non-blank secret yields 32 bytes.
   * "${ENV:default}" does not fall back when ENV is set but blank, hence the explicit check.
   */
  byte[] deriveKey(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (!env.acceptsProfiles(Profiles.of("dev"))) {
        throw new IllegalStateException("guide.auth.jwt-secret is empty. Set GUIDE_JWT_SECRET.");
      }
      s = DEV_SECRET;
    } else if (s.length() < 32) {
      log.warn("guide.auth.jwt-secret is shorter than 32 characters");
    }

    try {
      return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
