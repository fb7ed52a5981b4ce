package com.example.guardianservice.config;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.DryRunDiscordPlatformClient;
import com.example.guardianservice.client.JdaDiscordPlatformClient;
import com.example.guardianservice.client.ResilientDiscordClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Platform client wiring. Without a bot token the service runs against the in-memory dry-run
 * client; either way every call goes through the shared limiter and retry.
 */
@Configuration
@Slf4j
public class DiscordClientConfig {

    @Bean
    public ResilientDiscordClient discordPlatformClient(
            @Value("${guardian.discord.token:}") String token,
            RateLimiter discordRateLimiter,
            RetryRegistry retryRegistry) {
        return new ResilientDiscordClient(delegate(token), discordRateLimiter,
                retryRegistry.retry(ResilienceConfig.DISCORD));
    }

    private DiscordPlatformClient delegate(String token) {
        if (token == null || token.isBlank()) {
            log.warn("guardian.discord.token not set, using DRY RUN platform client");
            return new DryRunDiscordPlatformClient();
        }
        try {
            JDA jda = JDABuilder.createDefault(token)
                    .enableIntents(GatewayIntent.GUILD_MEMBERS)
                    .build()
                    .awaitReady();
            log.info("Connected to Discord as {} in {} guilds", jda.getSelfUser().getName(), jda.getGuilds().size());
            return new JdaDiscordPlatformClient(jda);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting to Discord", e);
        }
    }
}
