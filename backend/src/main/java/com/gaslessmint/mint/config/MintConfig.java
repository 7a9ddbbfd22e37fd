package com.gaslessmint.mint.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MintProperties.class)
public class MintConfig {
}
