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

package com.amazon.ansatz.serialize;

import lombok.Getter;

import com.amazon.ansatz.returntypes.FittingResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link FittingResult} serialization. The result is converted to a
 * {@link FittingResultState} by a {@link FittingResultMapper} and written with
 * <a href="https://github.com/google/gson">Gson</a>. Failed fits carry infinite
 * parameters, so the default Gson instance writes non-finite numbers as the
 * JavaScript literals {@code Infinity} and {@code NaN}.
 */
@Getter
public class FittingResultSerDe {

    private final FittingResultMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public FittingResultSerDe() {
        this(new FittingResultMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper converts results to state objects
     * @param gson   writes the state objects
     */
    public FittingResultSerDe(FittingResultMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public String toJson(FittingResult result) {
        return gson.toJson(mapper.toState(result));
    }

    public FittingResult fromJson(String json) {
        FittingResultState state = gson.fromJson(json, FittingResultState.class);
        return mapper.toModel(state);
    }
}
