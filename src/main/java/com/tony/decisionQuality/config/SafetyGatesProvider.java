package com.tony.decisionQuality.config;

import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Relit l'environnement à chaque appel : basculer un flag prend effet au prochain appel.
 */
@Component
@RequiredArgsConstructor
public class SafetyGatesProvider {

    private final Environment environment;

    public SafetyGates current() {
        return SafetyGates.fromEnvironment(environment);
    }
}
