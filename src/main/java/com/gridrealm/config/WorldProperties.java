package com.gridrealm.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * World dimensions, limits and tick cadence ({@code game.world.*}).
 *
 * @param width              number of columns; valid x is {@code [0, width)}
 * @param height             number of rows; valid y is {@code [0, height)}
 * @param tickIntervalMs     period of the snapshot broadcast
 * @param chatHistoryLimit   chat lines retained in the snapshot
 * @param chatMaxLength      maximum characters kept from one chat line
 * @param maxPlayers         concurrent connections accepted before refusing joins
 * @param runEnergyDrain     energy spent per tick while running
 * @param runEnergyRegen     energy recovered per tick while walking
 */
@Validated
@ConfigurationProperties(prefix = "game.world")
public record WorldProperties(
        @DefaultValue("100") @Min(1) int width,
        @DefaultValue("100") @Min(1) int height,
        @DefaultValue("600") @Min(1) long tickIntervalMs,
        @DefaultValue("100") @Min(1) int chatHistoryLimit,
        @DefaultValue("100") @Min(1) int chatMaxLength,
        @DefaultValue("2000") @Min(1) int maxPlayers,
        @DefaultValue("0.67") @PositiveOrZero double runEnergyDrain,
        @DefaultValue("0.45") @PositiveOrZero double runEnergyRegen) {

    public static WorldProperties defaults() {
        return new WorldProperties(100, 100, 600, 100, 100, 2000, 0.67, 0.45);
    }
}
