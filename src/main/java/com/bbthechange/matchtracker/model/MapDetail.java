package com.bbthechange.matchtracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-map statistics record. Upstream publishes these some time after the map score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapDetail {

    private String mapName;
    private String statsId;
}
