package io.b2mash.clauseguard.config;

import io.b2mash.clauseguard.solver.SolverProperties;
import io.b2mash.clauseguard.verification.VerificationCacheProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SolverProperties.class, VerificationCacheProperties.class})
public class VerificationConfig {}
