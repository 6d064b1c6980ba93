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

/**
 * A masked sample could not be rebuilt from its neighbourhood.
 */
public class ReconstructionException extends Exception {
    private final int index;

    public ReconstructionException(int index, String message) {
        super(message);
        this.index = index;
    }

    public ReconstructionException(int index, String message, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    /**
     * @return the signal index that failed
     */
    public int getIndex() {
        return index;
    }
}
