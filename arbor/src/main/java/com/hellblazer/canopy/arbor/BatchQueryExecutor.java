/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Canopy.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.canopy.arbor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs batched work on an executor: read only queries as one task per query shape, and the per item phase of batched
 * mutations as chunks over disjoint leaves. A returned future completes once every task has completed, and must be
 * awaited before its results are read.
 *
 * @author hal.hildebrand
 */
final class BatchQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchQueryExecutor.class);

    private final ExecutorService executorService;

    BatchQueryExecutor(ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Apply the query to every shape in parallel, answering the results in shape order
     */
    <Q, R> CompletableFuture<List<R>> map(List<Q> shapes, Function<Q, R> query) {
        if (shapes.isEmpty()) {
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        List<CompletableFuture<R>> futures = shapes.stream()
                                                   .map(shape -> CompletableFuture.supplyAsync(() -> query.apply(shape),
                                                                                               executorService))
                                                   .collect(Collectors.toList());

        CompletableFuture<Void> allFutures = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        return allFutures.thenApply(v -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()))
                         .whenComplete((results, error) -> {
                             if (error != null) {
                                 log.error("Batched query over {} shapes failed", shapes.size(), error);
                             }
                         });
    }

    /**
     * Apply the query to every shape in parallel, answering the union of the results
     */
    <Q, T> CompletableFuture<Set<T>> union(List<Q> shapes, Function<Q, ? extends Collection<T>> query) {
        return map(shapes, query).thenApply(partials -> {
            Set<T> result = new HashSet<>();
            for (Collection<T> partial : partials) {
                result.addAll(partial);
            }
            return result;
        });
    }

    /**
     * Run the action over consecutive chunks of the work list in parallel and wait for all of them
     */
    <W> void forEachChunk(List<W> work, int chunkSize, Consumer<W> action) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int start = 0; start < work.size(); start += chunkSize) {
            List<W> chunk = work.subList(start, Math.min(work.size(), start + chunkSize));
            futures.add(CompletableFuture.runAsync(() -> chunk.forEach(action), executorService));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }
}
