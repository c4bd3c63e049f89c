/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cm.batchmapping.schema;

import com.google.cm.batchmapping.models.TargetSchema;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaResolver} that asks its {@link SchemaRegistry} at most once per target id. An
 * instance lives for a single batch run, so schema changes are picked up by the next run.
 */
public final class CachingSchemaResolver implements SchemaResolver {

  private static final Logger logger = LoggerFactory.getLogger(CachingSchemaResolver.class);

  private final LoadingCache<String, TargetSchema> schemas;

  @Inject
  public CachingSchemaResolver(SchemaRegistry registry) {
    schemas =
        CacheBuilder.newBuilder()
            .build(
                new CacheLoader<>() {
                  @Override
                  public TargetSchema load(String targetId) {
                    return registry
                        .fetch(targetId)
                        .orElseThrow(() -> new SchemaNotFoundException(targetId));
                  }
                });
  }

  /** {@inheritDoc} */
  @Override
  public TargetSchema resolve(String targetId) {
    try {
      return schemas.getUnchecked(targetId);
    } catch (UncheckedExecutionException ex) {
      if (ex.getCause() instanceof SchemaNotFoundException) {
        logger.error(ex.getCause().getMessage());
      }
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw ex;
    }
  }
}
