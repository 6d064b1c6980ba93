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

public class ExtrapolationException extends ReconstructionException {
    private final int supportLower;
    private final int supportUpper;

    public ExtrapolationException(int index, int supportLower, int supportUpper) {
        super(index, String.format("Index %d lies outside its support range [%d, %d]", index, supportLower, supportUpper));
        this.supportLower = supportLower;
        this.supportUpper = supportUpper;
    }

    public int getSupportLower() {
        return supportLower;
    }

    public int getSupportUpper() {
        return supportUpper;
    }
}
