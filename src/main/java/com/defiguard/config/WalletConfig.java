package com.defiguard.config;

import com.defiguard.wallet.SecureWallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Creates the {@link SecureWallet} from the variable named by
 * {@code defiguard.wallet.key-env-var}, resolved through the Spring environment (in
 * production, the process environment). A missing or invalid key aborts startup.
 */
@Configuration
public class WalletConfig {

    private static final Logger log = LoggerFactory.getLogger(WalletConfig.class);

    @Bean
    public SecureWallet secureWallet(
            @Value("${defiguard.wallet.key-env-var}") String keyEnvVar, Environment environment) {
        SecureWallet wallet = SecureWallet.fromEnvironment(keyEnvVar, environment::getProperty);
        log.info("Wallet loaded [address={}]", wallet.getAddress());
        return wallet;
    }
}
