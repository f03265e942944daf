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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.model.IModel;

/**
 * The selected model together with the scores of the competition that chose
 * it.
 */
@Getter
@AllArgsConstructor
public class Selection {

    private final IModel model;

    /**
     * {@link SelectionState#GAUSSIAN_ACCEPTED} or {@link SelectionState#COMPETE}
     */
    private final SelectionState path;

    private final Map<Ansatz, Double> scores;

    public static Selection gaussian(IModel model) {
        return new Selection(model, SelectionState.GAUSSIAN_ACCEPTED, Collections.emptyMap());
    }

    public static Selection competition(IModel model, Map<Ansatz, Double> scores) {
        Map<Ansatz, Double> copy = new EnumMap<>(Ansatz.class);
        copy.putAll(scores);
        return new Selection(model, SelectionState.COMPETE, Collections.unmodifiableMap(copy));
    }
}
