package com.bbthechange.matchtracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapScore {

    private String mapName;
    private Integer scoreA;
    private Integer scoreB;

    public boolean isScored() {
        return scoreA != null && scoreB != null;
    }
}
