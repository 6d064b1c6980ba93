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

import edu.umich.andykong.spikeshepherd.interpolation.InterpolationKind;

import java.util.Locale;

public class InsufficientSupportException extends ReconstructionException {
    private final int supportCount;
    private final int requiredCount;

    public InsufficientSupportException(int index, int supportCount, InterpolationKind kind) {
        super(index, String.format("Index %d has %d unmasked support point(s) in its window, %s interpolation needs %d",
                index, supportCount, kind.name().toLowerCase(Locale.ROOT), kind.getMinSupport()));
        this.supportCount = supportCount;
        this.requiredCount = kind.getMinSupport();
    }

    public int getSupportCount() {
        return supportCount;
    }

    public int getRequiredCount() {
        return requiredCount;
    }
}
