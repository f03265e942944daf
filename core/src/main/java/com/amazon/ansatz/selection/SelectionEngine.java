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

import static com.amazon.ansatz.CommonUtils.checkNotNull;
import static com.amazon.ansatz.CommonUtils.isClose;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.ansatz.NoModelSelectableException;
import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.inputtypes.Series;
import com.amazon.ansatz.model.FitResult;
import com.amazon.ansatz.model.IModel;
import com.amazon.ansatz.model.IModelFactory;

/**
 * Chooses the model that explains a series. The Gaussian is tried first and
 * accepted without competition when the series passes the normality gate and
 * the errors of the fitted mean and standard deviation are small. Otherwise
 * the remaining enabled models are fit independently and the one with the
 * least information criterion score wins, unless its score is close to the
 * linear model's, in which case the linear model wins.
 */
public class SelectionEngine {

    private static final Logger logger = LogManager.getLogger(SelectionEngine.class);

    static final List<Ansatz> COMPETITORS = Collections
            .unmodifiableList(Arrays.asList(Ansatz.LINEAR_REGRESSION, Ansatz.STEP_FUNC, Ansatz.EXP_DECAY));

    private final Params params;

    private final IModelFactory factory;

    public SelectionEngine(Params params) {
        this(params, IModelFactory.standard());
    }

    public SelectionEngine(Params params, IModelFactory factory) {
        this.params = checkNotNull(params, "params must not be null");
        this.factory = checkNotNull(factory, "factory must not be null");
    }

    /**
     * @param series the validated series
     * @return the selected model, already fit
     * @throws NoModelSelectableException if every competing model failed
     */
    public Selection select(Series series) {
        double[] values = series.getValues();
        double[] time = series.getFittingTime(params.isScalelessTime());

        if (params.isEnabled(Ansatz.GAUSSIAN)) {
            IModel gaussian = factory.newModel(Ansatz.GAUSSIAN, time, values, params);
            if (gaussian.isApplicable()) {
                FitResult result = gaussian.fit();
                // the amplitude error does not count towards acceptance
                if (result.isConverged() && result.errorEnergy(1) <= params.getGaussianErr()) {
                    logger.debug("accepted {} with error energy {}", gaussian.getModelType(), result.errorEnergy(1));
                    return Selection.gaussian(gaussian);
                }
                logger.debug("discarded Gaussian fit, converged={} error energy={}", result.isConverged(),
                        result.errorEnergy(1));
            } else {
                logger.debug("series failed the normality gate");
            }
        }

        List<IModel> candidates = new ArrayList<>();
        for (Ansatz ansatz : COMPETITORS) {
            if (params.isEnabled(ansatz)) {
                candidates.add(factory.newModel(ansatz, time, values, params));
            }
        }
        return compete(candidates);
    }

    /**
     * fits every candidate once and picks the winner
     *
     * @param candidates unfit models in a fixed order; earlier candidates win
     *                   exact ties
     * @return the winner with the scores of all candidates
     */
    Selection compete(List<IModel> candidates) {
        List<IModel> fitted = fitAll(candidates);

        Map<Ansatz, Double> scores = new LinkedHashMap<>();
        IModel best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        for (IModel model : fitted) {
            double score = model.score(params.getInfoCriterion());
            scores.put(model.getAnsatz(), score);
            logger.debug("{} {} = {}", model.getAnsatz(), params.getInfoCriterion(), score);
            if (Double.isNaN(score) || score == Double.POSITIVE_INFINITY) {
                continue;
            }
            if (best == null || score < bestScore) {
                best = model;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new NoModelSelectableException("no model converged, scores " + scores, scores);
        }

        Double linearScore = scores.get(Ansatz.LINEAR_REGRESSION);
        if (linearScore != null && best.getAnsatz() != Ansatz.LINEAR_REGRESSION && isClose(bestScore, linearScore,
                params.getLinearTieAbsoluteTolerance(), params.getLinearTieRelativeTolerance())) {
            logger.debug("{} score {} is close to linear score {}, preferring linear", best.getAnsatz(), bestScore,
                    linearScore);
            best = fitted.stream().filter(m -> m.getAnsatz() == Ansatz.LINEAR_REGRESSION).findFirst().orElse(best);
        }
        return Selection.competition(best, scores);
    }

    List<IModel> fitAll(List<IModel> candidates) {
        if (!params.isParallelExecutionEnabled() || candidates.size() < 2) {
            candidates.forEach(IModel::fit);
            return candidates;
        }
        int threads = params.getThreadPoolSize().orElse(candidates.size());
        ForkJoinPool pool = new ForkJoinPool(threads);
        try {
            return submitAndJoin(pool, () -> candidates.parallelStream().map(model -> {
                model.fit();
                return model;
            }).collect(Collectors.toList()));
        } finally {
            pool.shutdown();
        }
    }

    private static <T> T submitAndJoin(ForkJoinPool pool, Callable<T> callable) {
        return pool.submit(callable).join();
    }
}
