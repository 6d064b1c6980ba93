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

import edu.umich.andykong.spikeshepherd.interpolation.InterpolationKind;
import edu.umich.andykong.spikeshepherd.paramhandling.DoubleParameter;
import edu.umich.andykong.spikeshepherd.paramhandling.EnumParameter;
import edu.umich.andykong.spikeshepherd.paramhandling.IntegerParameter;
import edu.umich.andykong.spikeshepherd.paramhandling.InvalidParameterException;
import edu.umich.andykong.spikeshepherd.paramhandling.ParameterGroup;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validated, immutable settings for one de-spiking run.
 */
public final class DespikeParams {

	public static final String GROUP_NAME = "despike";

	public static final String WIDTH_THRESHOLD = "width_threshold";
	public static final String PROMINENCE_THRESHOLD = "prominence_threshold";
	public static final String MOVING_AVERAGE_WINDOW = "moving_average_window";
	public static final String WIDTH_PARAM_REL = "width_param_rel";
	public static final String INTERP_KIND = "interp_kind";
	public static final String MASK_LEFT_PAD = "mask_left_pad";
	public static final String MASK_RIGHT_PAD = "mask_right_pad";
	public static final String THREADS = "threads";

	public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 10;
	public static final double DEFAULT_WIDTH_PARAM_REL = 0.8;
	public static final InterpolationKind DEFAULT_INTERP_KIND = InterpolationKind.LINEAR;

	private final double widthThreshold;
	private final double prominenceThreshold;
	private final int movingAverageWindow;
	private final double widthParamRel;
	private final InterpolationKind interpKind;
	private final int maskLeftPad;
	private final int maskRightPad;
	private final int threads;

	private DespikeParams(ParameterGroup group) {
		group.checkRequired();
		this.widthThreshold = group.<Double>getParamValue(WIDTH_THRESHOLD);
		this.prominenceThreshold = group.<Double>getParamValue(PROMINENCE_THRESHOLD);
		this.movingAverageWindow = group.<Integer>getParamValue(MOVING_AVERAGE_WINDOW);
		this.widthParamRel = group.<Double>getParamValue(WIDTH_PARAM_REL);
		this.interpKind = group.getParamValue(INTERP_KIND);
		this.maskLeftPad = group.<Integer>getParamValue(MASK_LEFT_PAD);
		this.maskRightPad = group.<Integer>getParamValue(MASK_RIGHT_PAD);
		int t = group.<Integer>getParamValue(THREADS);
		this.threads = t == 0 ? Runtime.getRuntime().availableProcessors() : t;
	}

	/**
	 * @return a fresh group holding every parameter at its default; thresholds start unset
	 */
	public static ParameterGroup newParameterGroup() {
		ParameterGroup group = new ParameterGroup(GROUP_NAME);
		group.addParam(new DoubleParameter(WIDTH_THRESHOLD, 0, Double.MAX_VALUE, null,
				"peaks narrower than this at half prominence are spikes"));
		group.addParam(new DoubleParameter(PROMINENCE_THRESHOLD, 0, Double.MAX_VALUE, null,
				"minimum prominence for a local maximum to count as a peak"));
		group.addParam(new IntegerParameter(MOVING_AVERAGE_WINDOW, 1, Integer.MAX_VALUE, DEFAULT_MOVING_AVERAGE_WINDOW,
				"samples on each side searched for interpolation support"));
		group.addParam(new DoubleParameter(WIDTH_PARAM_REL, 0, 1, DEFAULT_WIDTH_PARAM_REL,
				"relative prominence height at which the masked region is measured"));
		group.addParam(new EnumParameter<>(INTERP_KIND, InterpolationKind.class, DEFAULT_INTERP_KIND,
				"linear, quadratic or cubic"));
		group.addParam(new IntegerParameter(MASK_LEFT_PAD, 0, Integer.MAX_VALUE, 1,
				"extra samples masked left of each spike region"));
		group.addParam(new IntegerParameter(MASK_RIGHT_PAD, 0, Integer.MAX_VALUE, 1,
				"extra samples masked right of each spike region"));
		group.addParam(new IntegerParameter(THREADS, 0, 1024, 1,
				"reconstruction threads, 0 = available processors"));
		return group;
	}

	public static DespikeParams fromGroup(ParameterGroup group) {
		return new DespikeParams(group);
	}

	public static DespikeParams fromMap(Map<String, String> values) {
		ParameterGroup group = newParameterGroup();
		for (Map.Entry<String, String> e : values.entrySet())
			group.parseParamValue(e.getKey().trim(), e.getValue());
		return new DespikeParams(group);
	}

	/**
	 * Parses {@code key = value} lines. Text after {@code //} is a comment, lines without {@code =} are skipped.
	 */
	public static DespikeParams fromLines(List<String> lines) {
		ParameterGroup group = newParameterGroup();
		for (String cline : lines) {
			int comments = cline.indexOf("//");
			if (comments >= 0)
				cline = cline.substring(0, comments);
			cline = cline.trim();
			if (cline.length() == 0 || cline.indexOf("=") < 0)
				continue;
			String key = cline.substring(0, cline.indexOf("=")).trim();
			String value = cline.substring(cline.indexOf("=") + 1).trim();
			if (value.isEmpty())
				throw new InvalidParameterException(key, "missing value");
			group.parseParamValue(key, value);
		}
		return new DespikeParams(group);
	}

	public static Builder builder(double widthThreshold, double prominenceThreshold) {
		return new Builder(widthThreshold, prominenceThreshold);
	}

	public static class Builder {
		private final ParameterGroup group = newParameterGroup();

		private Builder(double widthThreshold, double prominenceThreshold) {
			group.setParamValue(WIDTH_THRESHOLD, widthThreshold);
			group.setParamValue(PROMINENCE_THRESHOLD, prominenceThreshold);
		}

		public Builder movingAverageWindow(int window) {
			group.setParamValue(MOVING_AVERAGE_WINDOW, window);
			return this;
		}

		public Builder widthParamRel(double rel) {
			group.setParamValue(WIDTH_PARAM_REL, rel);
			return this;
		}

		public Builder interpKind(InterpolationKind kind) {
			group.setParamValue(INTERP_KIND, kind);
			return this;
		}

		public Builder interpKind(String kind) {
			group.parseParamValue(INTERP_KIND, kind);
			return this;
		}

		public Builder maskPads(int left, int right) {
			group.setParamValue(MASK_LEFT_PAD, left);
			group.setParamValue(MASK_RIGHT_PAD, right);
			return this;
		}

		public Builder threads(int threads) {
			group.setParamValue(THREADS, threads);
			return this;
		}

		public DespikeParams build() {
			return new DespikeParams(group);
		}
	}

	public double getWidthThreshold() {
		return widthThreshold;
	}

	public double getProminenceThreshold() {
		return prominenceThreshold;
	}

	public int getMovingAverageWindow() {
		return movingAverageWindow;
	}

	public double getWidthParamRel() {
		return widthParamRel;
	}

	public InterpolationKind getInterpKind() {
		return interpKind;
	}

	public int getMaskLeftPad() {
		return maskLeftPad;
	}

	public int getMaskRightPad() {
		return maskRightPad;
	}

	public int getThreads() {
		return threads;
	}

	@Override
	public String toString() {
		return String.format("%s = %s, %s = %s, %s = %d, %s = %s, %s = %s, %s = %d, %s = %d, %s = %d",
				WIDTH_THRESHOLD, widthThreshold, PROMINENCE_THRESHOLD, prominenceThreshold,
				MOVING_AVERAGE_WINDOW, movingAverageWindow, WIDTH_PARAM_REL, widthParamRel,
				INTERP_KIND, interpKind.name().toLowerCase(Locale.ROOT), MASK_LEFT_PAD, maskLeftPad,
				MASK_RIGHT_PAD, maskRightPad, THREADS, threads);
	}
}
