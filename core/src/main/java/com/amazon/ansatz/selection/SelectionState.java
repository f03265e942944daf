/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.ansatz.selection;

/**
 * The stages of one detection run. A run either accepts the Gaussian after the
 * normality check or fits the competing models; both paths then continue
 * through scoring, outlier extraction and diagnostics.
 */
public enum SelectionState {

    START, NORMALITY_CHECK, GAUSSIAN_ACCEPTED, COMPETE, SCORED, OUTLIERS_EXTRACTED, DIAGNOSED, DONE;

    /**
     * @param next the candidate next stage
     * @return true if a run may move from this stage to the next
     */
    public boolean canAdvanceTo(SelectionState next) {
        switch (this) {
        case START:
            return next == NORMALITY_CHECK;
        case NORMALITY_CHECK:
            return next == GAUSSIAN_ACCEPTED || next == COMPETE;
        case GAUSSIAN_ACCEPTED:
        case COMPETE:
            return next == SCORED;
        case SCORED:
            return next == OUTLIERS_EXTRACTED;
        case OUTLIERS_EXTRACTED:
            return next == DIAGNOSED;
        case DIAGNOSED:
            return next == DONE;
        default:
            return false;
        }
    }
}
