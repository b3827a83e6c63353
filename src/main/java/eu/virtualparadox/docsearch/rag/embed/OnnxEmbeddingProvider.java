package eu.virtualparadox.docsearch.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.docsearch.application.config.ApplicationConfig;
import eu.virtualparadox.docsearch.application.config.IndexingProperties;
import eu.virtualparadox.docsearch.exception.EmbeddingFatalException;
import eu.virtualparadox.docsearch.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embeddings from a local ONNX encoder: mean pooling over the attention mask followed
 * by L2 normalization, so cosine similarity equals the dot product.
 * <p>
 * The model is expected under {@code <models>/embedding/} as {@code model.onnx} and
 * {@code tokenizer.json}. When they are missing the application still starts; every call then
 * fails with {@link EmbeddingFatalException}.
 * <p>
 * {@link OrtSession#run} is thread-safe, so one session serves all embedding workers.
 */
@Service
public class OnnxEmbeddingProvider implements EmbeddingProvider {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingProvider.class);

    private static final int MAX_LEN = 512;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int workers;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingProvider(final ApplicationConfig config, final IndexingProperties properties) {
        final Path modelRoot = config.getModels().resolve("embedding");
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
        this.workers = properties.getEmbedding().getMaxWorkers();
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        if (!Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
            logger.warn("Embedding model not found at {}; indexing and search will fail until it is installed",
                    modelPath.getParent());
            return;
        }

        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(workers));
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        logger.info("Loaded ONNX embedding model: {}", modelPath);
        logger.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public String modelId() {
        return modelPath.getParent().getFileName().toString();
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        if (session == null) {
            throw new EmbeddingFatalException("Embedding model is not loaded: " + modelPath);
        }
        if (texts == null || texts.isEmpty()) {
            throw new EmbeddingFatalException("Nothing to embed");
        }

        final List<Encoding> encodings = new ArrayList<>(texts.size());
        int maxLen = 0;
        for (final String text : texts) {
            final Encoding e = tokenizer.encode(text);
            encodings.add(e);
            maxLen = Math.max(maxLen, e.getIds().length);
        }
        maxLen = Math.min(maxLen, MAX_LEN);

        final int batchSize = encodings.size();
        final long[][] inputIdArr = new long[batchSize][maxLen];
        final long[][] attnMaskArr = new long[batchSize][maxLen];
        final long[][] tokenTypeArr = new long[batchSize][maxLen];

        for (int i = 0; i < batchSize; i++) {
            final long[] ids = encodings.get(i).getIds();
            final long[] mask = encodings.get(i).getAttentionMask();
            final int len = Math.min(ids.length, maxLen);

            System.arraycopy(ids, 0, inputIdArr[i], 0, len);
            System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
        }

        try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
             final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
             final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (session.getInputNames().contains("input_ids")) {
                inputs.put("input_ids", inputIds);
            }
            if (session.getInputNames().contains("attention_mask")) {
                inputs.put("attention_mask", attentionMask);
            }
            if (session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypeTensor);
            }

            try (final OrtSession.Result result = session.run(inputs)) {
                final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                final List<float[]> out = new ArrayList<>(batchSize);
                for (int i = 0; i < batchSize; i++) {
                    final float[] vec = meanPool(embeddings[i], attnMaskArr[i]);
                    normalize(vec);
                    out.add(vec);
                }
                return out;
            }
        } catch (final OrtException e) {
            throw new EmbeddingFatalException("ONNX inference failed for batch of " + batchSize, e);
        }
    }

    private static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    private static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
