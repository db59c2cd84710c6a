package com.bbthechange.matchtracker.dto;

import com.bbthechange.matchtracker.model.EventPhase;
import com.bbthechange.matchtracker.model.PollState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Diagnostic snapshot of the tracker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackerStatus {

    private PollState pollState;
    private Map<String, EventPhase> eventPhases;
    private Set<String> wakeupTimers;
}
