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

package edu.umich.andykong.spikeshepherd.spikes;

import java.util.Arrays;

/**
 * Read-only per-sample flags marking samples to be replaced.
 */
public final class SpikeMask {

    private final boolean[] masked;
    private final int count;

    SpikeMask(boolean[] masked) {
        this.masked = masked;
        int c = 0;
        for (boolean b : masked) {
            if (b)
                c++;
        }
        this.count = c;
    }

    public static SpikeMask of(boolean[] flags) {
        return new SpikeMask(flags.clone());
    }

    public static SpikeMask empty(int length) {
        return new SpikeMask(new boolean[length]);
    }

    public boolean isMasked(int i) {
        return masked[i];
    }

    public int length() {
        return masked.length;
    }

    public int countMasked() {
        return count;
    }

    /**
     * @return ascending indices of masked samples
     */
    public int[] maskedIndices() {
        int[] res = new int[count];
        int p = 0;
        for (int i = 0; i < masked.length; i++) {
            if (masked[i])
                res[p++] = i;
        }
        return res;
    }

    public boolean[] toArray() {
        return masked.clone();
    }

    /**
     * @return true when every sample masked here is also masked in {@code other}
     */
    public boolean isSubsetOf(SpikeMask other) {
        if (other.length() != length())
            return false;
        for (int i = 0; i < masked.length; i++) {
            if (masked[i] && !other.masked[i])
                return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpikeMask))
            return false;
        return Arrays.equals(masked, ((SpikeMask) o).masked);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(masked);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (boolean b : masked)
            sb.append(b ? '1' : '0');
        return sb.toString();
    }
}
