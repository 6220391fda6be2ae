/*
 * Where: Monitor configuration binding
 * What: Symmetric key used to encrypt stored identity values
 * Why: Identities are never stored in clear and the key must exist before the first scan
 */
package com.breachwatch.monitor.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor.identity")
@Validated
public record IdentityProtectionProperties(@NotBlank String encryptionKey) {}
