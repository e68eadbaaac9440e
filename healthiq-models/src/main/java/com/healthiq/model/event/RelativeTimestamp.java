package com.healthiq.model.event;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Human-first relative time, e.g. reference "program_start" with offset "Day +12".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class RelativeTimestamp {
    protected String reference;
    protected String offset;
}
