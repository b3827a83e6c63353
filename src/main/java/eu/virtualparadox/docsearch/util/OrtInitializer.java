package eu.virtualparadox.docsearch.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options for CPU inference. Intra-op parallelism is divided among the
     * embedding workers so that concurrent batches do not oversubscribe the cores.
     *
     * @param concurrentSessions number of batches expected to run at the same time
     */
    public static OrtSession.SessionOptions initializeOrt(final int concurrentSessions) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            // leave one core free for the dispatcher and the vector store
            final int usable = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
            final int intraThreads = Math.max(1, usable / Math.max(1, concurrentSessions));

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session: intra-op threads {}, inter-op threads 1, {} concurrent sessions",
                    intraThreads, concurrentSessions);
            return opts;
        } catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
