package com.modelgate.governance;

import java.io.IOException;

import com.modelgate.pipeline.ModelArtifact;
import com.modelgate.tracking.ExperimentTracker;
import com.modelgate.tracking.RunStatus;
import com.modelgate.tracking.TrackedRun;

/**
 * Reads the model artifact of a finished run back from the tracker.
 */
public class ArtifactLoader {
    private final ExperimentTracker tracker;

    public ArtifactLoader(ExperimentTracker tracker) {
        this.tracker = tracker;
    }

    /**
     * @throws com.modelgate.tracking.RunNotFoundException when the run is unknown
     * @throws ArtifactNotFoundException when the run did not finish or its artifact is absent or corrupt
     */
    public ModelArtifact load(String runId, String artifactPath) throws IOException {
        TrackedRun run = tracker.getRun(runId);
        if (run.status() != RunStatus.FINISHED) {
            throw new ArtifactNotFoundException("Run " + runId + " is " + run.status() + " and has no usable model artifact");
        }
        String location = ModelArtifact.location(artifactPath);
        byte[] content = tracker.readArtifact(runId, location)
                .orElseThrow(() -> new ArtifactNotFoundException("Run " + runId + " has no artifact " + location));
        try {
            return ModelArtifact.fromJson(content);
        } catch (IOException e) {
            throw new ArtifactNotFoundException("Model artifact " + location + " of run " + runId + " is corrupt", e);
        }
    }
}
