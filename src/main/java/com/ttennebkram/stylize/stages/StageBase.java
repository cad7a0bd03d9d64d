package com.ttennebkram.stylize.stages;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.state.ArtifactKey;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Common plumbing for the built-in stages: name, kind, declared keys and
 * access to the stage's own configuration section.
 */
public abstract class StageBase implements Stage {

    protected final Configuration configuration;
    protected final ConfigSection config;

    private final String name;
    private final StageKind kind;
    private final Set<ArtifactKey> reads;
    private final Set<ArtifactKey> writes;

    protected StageBase(String name, StageKind kind, Configuration configuration, String sectionName,
                        Set<ArtifactKey> reads, Set<ArtifactKey> writes) {
        this.name = name;
        this.kind = kind;
        this.configuration = configuration;
        this.config = configuration.getStageSection(sectionName);
        this.reads = Collections.unmodifiableSet(EnumSet.copyOf(reads));
        this.writes = Collections.unmodifiableSet(EnumSet.copyOf(writes));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public StageKind getKind() {
        return kind;
    }

    @Override
    public Set<ArtifactKey> reads() {
        return reads;
    }

    @Override
    public Set<ArtifactKey> writes() {
        return writes;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
