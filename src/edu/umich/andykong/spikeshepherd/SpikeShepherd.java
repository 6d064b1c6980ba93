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

package edu.umich.andykong.spikeshepherd;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.umich.andykong.spikeshepherd.interpolation.InterpolationKind;
import edu.umich.andykong.spikeshepherd.paramhandling.InvalidParameterException;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakFeature;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakPicker;
import edu.umich.andykong.spikeshepherd.reconstruction.LocalReconstructor;
import edu.umich.andykong.spikeshepherd.reconstruction.ReconstructionException;
import edu.umich.andykong.spikeshepherd.spikes.SpikeMask;
import edu.umich.andykong.spikeshepherd.spikes.SpikeMasker;
import edu.umich.andykong.spikeshepherd.spikes.WidthClassifier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Removes narrow spikes from a sampled signal: peaks are picked by prominence, classified by their
 * half-prominence width, masked, and the masked samples are re-interpolated from their unmasked
 * neighbours.
 * <p>
 * After N. Coca-Lopez, "An intuitive approach for spike removal in Raman spectra based on peaks'
 * prominence and width", Anal. Chim. Acta (2024), doi:10.1016/j.aca.2024.342312.
 */
public class SpikeShepherd {
	private static final Logger log = LoggerFactory.getLogger(SpikeShepherd.class);

	private SpikeShepherd() {
	}

	public static double [] removeSpikes(double [] signal, double widthThreshold, double prominenceThreshold) throws ReconstructionException {
		return despike(signal, DespikeParams.builder(widthThreshold, prominenceThreshold).build()).getSignal();
	}

	public static double [] removeSpikes(double [] signal, double widthThreshold, double prominenceThreshold,
										 int movingAverageWindow, double widthParamRel, InterpolationKind interpKind) throws ReconstructionException {
		DespikeParams params = DespikeParams.builder(widthThreshold, prominenceThreshold)
				.movingAverageWindow(movingAverageWindow)
				.widthParamRel(widthParamRel)
				.interpKind(interpKind)
				.build();
		return despike(signal, params).getSignal();
	}

	/**
	 * Runs the pipeline, using a private thread pool for reconstruction when {@code threads > 1}.
	 */
	public static DespikeResult despike(double [] signal, @NotNull DespikeParams params) throws ReconstructionException {
		if(params.getThreads() <= 1)
			return despike(signal, params, null);
		ExecutorService executorService = Executors.newFixedThreadPool(params.getThreads(),
				new ThreadFactoryBuilder().setNameFormat("spikeshepherd-%d").setDaemon(true).build());
		try {
			return despike(signal, params, executorService);
		} finally {
			executorService.shutdownNow();
		}
	}

	/**
	 * Runs the pipeline. A non-null {@code executorService} is used for reconstruction with
	 * {@code params.getThreads()} blocks and is left running.
	 *
	 * @throws InvalidParameterException if the signal is null or holds non-finite samples
	 * @throws ReconstructionException if a masked sample cannot be rebuilt
	 */
	public static DespikeResult despike(double [] signal, @NotNull DespikeParams params, ExecutorService executorService) throws ReconstructionException {
		checkSignal(signal);
		double [] v = signal.clone();
		log.debug("Despiking {} samples with {}", v.length, params);

		ImmutableList<PeakFeature> peaks = new PeakPicker(params.getProminenceThreshold()).pickPeaks(v);
		ImmutableList<PeakFeature> spikes = new WidthClassifier(params.getWidthThreshold()).classify(v, peaks);
		SpikeMask mask = new SpikeMasker(params.getWidthParamRel(), params.getMaskLeftPad(), params.getMaskRightPad()).mask(v, spikes);
		log.debug("Found {} peaks, {} spikes, {} masked samples", peaks.size(), spikes.size(), mask.countMasked());

		if(mask.countMasked() == 0)
			return new DespikeResult(v, peaks, spikes, mask);

		LocalReconstructor reconstructor = new LocalReconstructor(params.getMovingAverageWindow(), params.getInterpKind());
		double [] out;
		try {
			if(executorService == null)
				out = reconstructor.reconstruct(v, mask);
			else
				out = reconstructor.reconstruct(v, mask, executorService, params.getThreads());
		} catch (ReconstructionException e) {
			log.warn("Spike removal failed at index {}: {}", e.getIndex(), e.getMessage());
			throw e;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while reconstructing spikes", e);
		}
		return new DespikeResult(out, peaks, spikes, mask);
	}

	private static void checkSignal(double [] signal) {
		if(signal == null)
			throw new InvalidParameterException("signal", "signal must not be null");
		for(int i = 0; i < signal.length; i++) {
			if(!Double.isFinite(signal[i]))
				throw new InvalidParameterException("signal", String.format("sample %d is not finite (%s)", i, signal[i]));
		}
	}
}
