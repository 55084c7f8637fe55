package com.cashflow.config;

import com.cashflow.engine.GameEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Randomness and time sources for the game engine. Tests build their own engine with a seeded
 * {@link Random} and a fixed {@link Clock}.
 */
@Configuration
public class GameConfig {

    @Bean
    public Random gameRandom() {
        return new SecureRandom();
    }

    @Bean
    public Clock gameClock() {
        return Clock.systemUTC();
    }

    @Bean
    public GameEngine gameEngine(Random gameRandom, Clock gameClock) {
        return new GameEngine(gameRandom, gameClock);
    }
}
