package com.sommerph.makoto.config;

import com.sommerph.makoto.util.KeyUtils;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class CryptoProviderConfig {

    @PostConstruct
    public void registerProvider() {
        if (KeyUtils.ensureProvider()) {
            log.info("Registered BouncyCastle security provider");
        } else {
            log.debug("BouncyCastle security provider already registered");
        }
    }
}
