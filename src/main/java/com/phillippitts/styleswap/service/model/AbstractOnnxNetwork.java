package com.phillippitts.styleswap.service.model;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ExternalModelException;
import com.phillippitts.styleswap.exception.ExternalModelExceptionBuilder;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.FloatBuffer;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Base class for networks executed by ONNX Runtime, providing session lifecycle and
 * {@link FeatureMap} conversion.
 *
 * <p>Tensors cross the boundary as {@code 1 × C × H × W} float32 in NCHW layout. The session is
 * created once by {@link #initialize()} and shared by all forward passes.
 *
 * <p><b>Thread Safety:</b> Lifecycle transitions are synchronized on an internal lock. Forward
 * passes run outside the lock; ONNX Runtime sessions accept concurrent {@code run} calls, but
 * callers that need strict serialization must provide it themselves.
 *
 * <p><b>Idempotency:</b> Both {@link #initialize()} and {@link #close()} are idempotent.
 *
 * @see OnnxFeatureExtractor
 * @see OnnxInverseNetwork
 */
public abstract class AbstractOnnxNetwork implements NetworkAdapter {

    private static final Logger LOG = LogManager.getLogger(AbstractOnnxNetwork.class);

    protected final Object lock = new Object();

    private final String modelPath;
    private final String inputName;
    private final String outputName;

    // @GuardedBy("lock")
    private OrtEnvironment environment;
    // @GuardedBy("lock")
    private OrtSession session;
    // @GuardedBy("lock")
    private boolean initialized = false;
    // @GuardedBy("lock")
    private boolean closed = false;

    protected AbstractOnnxNetwork(String modelPath, String inputName, String outputName) {
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath must not be null");
        this.inputName = Objects.requireNonNull(inputName, "inputName must not be null");
        this.outputName = Objects.requireNonNull(outputName, "outputName must not be null");
    }

    /**
     * Creates the ONNX Runtime session. Supports reinitialization after close.
     *
     * @throws ExternalModelException if the graph cannot be loaded
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            LOG.info("Initializing {} network: modelPath={}, input={}, output={}",
                    getNetworkName(), modelPath, inputName, outputName);
            long start = System.nanoTime();
            try {
                OrtEnvironment env = OrtEnvironment.getEnvironment();
                try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
                    this.session = env.createSession(modelPath, options);
                }
                this.environment = env;
                initialized = true;
                closed = false;
                LOG.info("{} network initialized in {} ms (inputs={}, outputs={})",
                        getNetworkName(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start),
                        session.getInputNames(), session.getOutputNames());
            } catch (OrtException | RuntimeException | LinkageError e) {
                safeCloseUnlocked();
                throw ExternalModelExceptionBuilder.create("Failed to initialize " + getNetworkName() + " network")
                        .network(getNetworkName())
                        .cause(e)
                        .metadata("modelPath", modelPath)
                        .build();
            }
        }
    }

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Releases the session. Invoked by the Spring container on shutdown.
     */
    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            safeCloseUnlocked();
            closed = true;
            initialized = false;
            LOG.info("{} network closed", getNetworkName());
        }
    }

    /**
     * Runs one forward pass.
     *
     * @param input tensor passed as a batch of one
     * @return the configured output, without the batch axis
     * @throws ExternalModelException if the network is not initialized or inference fails
     */
    protected final FeatureMap runForward(FeatureMap input) {
        Objects.requireNonNull(input, "input must not be null");
        OrtEnvironment env;
        OrtSession localSession;
        synchronized (lock) {
            if (!initialized || closed) {
                throw new ExternalModelException(
                        getNetworkName() + " network not initialized or closed", getNetworkName());
            }
            env = this.environment;
            localSession = this.session;
        }

        long start = System.nanoTime();
        long[] inputShape = {1, input.channels(), input.height(), input.width()};
        try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(input.data()), inputShape);
             OrtSession.Result result = localSession.run(Map.of(inputName, tensor))) {
            OnnxValue value = result.get(outputName).orElseThrow(() ->
                    ExternalModelExceptionBuilder.create("Network output missing")
                            .network(getNetworkName())
                            .metadata("output", outputName)
                            .build());
            FeatureMap output = toFeatureMap(value);
            LOG.debug("{} forward pass {} -> {} in {} ms",
                    getNetworkName(), input.shape(), output.shape(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return output;
        } catch (OrtException e) {
            throw ExternalModelExceptionBuilder.create("Forward pass failed")
                    .network(getNetworkName())
                    .cause(e)
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                    .metadata("inputShape", input.shape())
                    .build();
        }
    }

    private FeatureMap toFeatureMap(OnnxValue value) {
        if (!(value instanceof OnnxTensor tensor)) {
            throw new ExternalModelException("Output '" + outputName + "' is not a tensor", getNetworkName());
        }
        long[] shape = tensor.getInfo().getShape();
        boolean batched = shape.length == 4 && shape[0] == 1;
        if (!batched && shape.length != 3) {
            throw new ExternalModelException("Unexpected output shape " + Arrays.toString(shape), getNetworkName());
        }
        int offset = batched ? 1 : 0;
        FloatBuffer buffer = tensor.getFloatBuffer();
        if (buffer == null) {
            throw new ExternalModelException("Output '" + outputName + "' is not float32", getNetworkName());
        }
        float[] data = new float[buffer.remaining()];
        buffer.get(data);
        return new FeatureMap(
                Math.toIntExact(shape[offset]),
                Math.toIntExact(shape[offset + 1]),
                Math.toIntExact(shape[offset + 2]),
                data);
    }

    // Caller must hold lock.
    private void safeCloseUnlocked() {
        if (session != null) {
            try {
                session.close();
            } catch (OrtException | RuntimeException e) {
                LOG.warn("Error closing {} session", getNetworkName(), e);
            }
            session = null;
        }
    }

    public String getModelPath() {
        return modelPath;
    }
}
