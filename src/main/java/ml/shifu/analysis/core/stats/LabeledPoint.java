/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.analysis.core.stats;

import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * A point that remembers its row position so cluster memberships can be mapped back to labels.
 */
public class LabeledPoint implements Clusterable {

    private final int position;

    private final double[] point;

    public LabeledPoint(int position, double[] point) {
        this.position = position;
        this.point = point;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public double[] getPoint() {
        return point;
    }
}
