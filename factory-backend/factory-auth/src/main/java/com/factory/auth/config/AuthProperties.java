package com.factory.auth.config;

import com.factory.auth.domain.constants.AuthConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "factory.auth")
public class AuthProperties {

    /**
     * HMAC secret, at least 32 bytes. Blank means generate one at startup (development only).
     */
    private String jwtSecret = "";

    private Duration accessTokenTtl = Duration.ofMinutes(15);

    private Duration refreshTokenTtl = Duration.ofDays(7);

    private int bcryptCost = AuthConstants.DEFAULT_BCRYPT_COST_FACTOR;

    /**
     * Issue a new refresh token on every refresh instead of handing back the presented one.
     */
    private boolean rotateRefreshTokens = true;

    private Grpc grpc = new Grpc();

    @Data
    public static class Grpc {
        private boolean enabled = true;
        private int port = 9090;
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);
    }
}
