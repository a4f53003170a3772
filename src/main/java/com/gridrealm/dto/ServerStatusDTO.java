package com.gridrealm.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the HTTP status endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServerStatusDTO {

    private long tick;
    private int playerCount;
    private int connectionCount;
    private int chatMessageCount;
    private int worldObjectCount;
    private long tickIntervalMs;
    private int worldWidth;
    private int worldHeight;
}
