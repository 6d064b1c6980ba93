/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.spikeshepherd.reconstruction;

import edu.umich.andykong.spikeshepherd.interpolation.Interpolant;
import edu.umich.andykong.spikeshepherd.interpolation.InterpolationKind;
import edu.umich.andykong.spikeshepherd.spikes.SpikeMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Replaces masked samples with values interpolated from unmasked samples within
 * {@code movingAverageWindow} positions on either side.
 * <p>
 * Every sample is rebuilt from the original signal and the original mask only, so samples can be
 * processed in any order, or concurrently, with the same result.
 */
public class LocalReconstructor {
    private static final Logger log = LoggerFactory.getLogger(LocalReconstructor.class);

    private final int movingAverageWindow;
    private final InterpolationKind kind;

    public LocalReconstructor(int movingAverageWindow, InterpolationKind kind) {
        if (movingAverageWindow < 1)
            throw new IllegalArgumentException("Window must be >= 1, got " + movingAverageWindow);
        if (kind == null)
            throw new IllegalArgumentException("Interpolation kind must not be null");
        this.movingAverageWindow = movingAverageWindow;
        this.kind = kind;
    }

    public double[] reconstruct(double[] signal, SpikeMask mask) throws ReconstructionException {
        checkLengths(signal, mask);
        double[] out = signal.clone();
        int[] masked = mask.maskedIndices();
        reconstructBlock(signal, mask, masked, 0, masked.length, out);
        return out;
    }

    public double[] reconstruct(double[] signal, SpikeMask mask, ExecutorService executorService, int nThreads)
            throws ReconstructionException, InterruptedException {
        checkLengths(signal, mask);
        int[] masked = mask.maskedIndices();
        if (nThreads <= 1 || masked.length < 2 * nThreads)
            return reconstruct(signal, mask);

        double[] out = signal.clone();
        /* Split masked indices into contiguous blocks, one per thread */
        final int BLOCKSIZE = masked.length / nThreads;
        List<Future<?>> futureList = new ArrayList<>(nThreads);
        for (int i = 0; i < nThreads; i++) {
            int istart = i * BLOCKSIZE;
            int iend = (i == nThreads - 1) ? masked.length : (i + 1) * BLOCKSIZE;
            futureList.add(executorService.submit(() -> {
                reconstructBlock(signal, mask, masked, istart, iend, out);
                return null;
            }));
        }
        log.debug("Reconstructing {} samples in {} blocks", masked.length, nThreads);

        /* Blocks are checked in index order so the lowest failing index is the one reported */
        try {
            for (Future<?> future : futureList) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ReconstructionException)
                        throw (ReconstructionException) cause;
                    if (cause instanceof RuntimeException)
                        throw (RuntimeException) cause;
                    if (cause instanceof Error)
                        throw (Error) cause;
                    throw new IllegalStateException("Reconstruction task failed", cause);
                }
            }
        } finally {
            for (Future<?> future : futureList)
                future.cancel(true);
        }
        return out;
    }

    private void reconstructBlock(double[] signal, SpikeMask mask, int[] masked, int istart, int iend, double[] out)
            throws ReconstructionException {
        for (int p = istart; p < iend; p++) {
            int i = masked[p];
            out[i] = reconstructSample(signal, mask, i);
        }
    }

    /**
     * Interpolated replacement for sample {@code i}.
     *
     * @throws InsufficientSupportException if the window holds fewer unmasked samples than the kind needs
     * @throws ExtrapolationException if {@code i} is not enclosed by the unmasked samples of its window
     */
    public double reconstructSample(double[] signal, SpikeMask mask, int i) throws ReconstructionException {
        int[] support = supportIndices(mask, i);
        if (support.length < kind.getMinSupport())
            throw new InsufficientSupportException(i, support.length, kind);
        int lower = support[0];
        int upper = support[support.length - 1];
        if (i < lower || i > upper)
            throw new ExtrapolationException(i, lower, upper);

        double[] x = new double[support.length];
        double[] y = new double[support.length];
        for (int j = 0; j < support.length; j++) {
            x[j] = support[j];
            y[j] = signal[support[j]];
        }
        Interpolant interpolant;
        try {
            interpolant = kind.fit(x, y);
        } catch (RuntimeException e) {
            throw new ReconstructionException(i, String.format("Could not fit %s interpolant for index %d over support %s",
                    kind, i, Arrays.toString(support)), e);
        }
        return interpolant.value(i);
    }

    /**
     * @return ascending unmasked indices within {@code [i - window, i + window]}, clipped to the signal
     */
    public int[] supportIndices(SpikeMask mask, int i) {
        int from = Math.max(0, i - movingAverageWindow);
        int to = (int) Math.min((long) i + movingAverageWindow, mask.length() - 1);
        int[] buf = new int[to - from + 1];
        int n = 0;
        for (int j = from; j <= to; j++) {
            if (!mask.isMasked(j))
                buf[n++] = j;
        }
        return Arrays.copyOf(buf, n);
    }

    private static void checkLengths(double[] signal, SpikeMask mask) {
        if (signal.length != mask.length())
            throw new IllegalArgumentException(String.format("Signal length %d does not match mask length %d",
                    signal.length, mask.length()));
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    public InterpolationKind getKind() {
        return kind;
    }
}
