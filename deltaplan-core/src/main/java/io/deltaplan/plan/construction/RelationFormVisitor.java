/*
 * RelationFormVisitor.java
 *
 * This source file is part of the deltaplan open source project
 *
 * Copyright 2021-2024 the deltaplan project authors
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

package io.deltaplan.plan.construction;

import io.deltaplan.annotation.API;

import javax.annotation.Nonnull;

/**
 * Visitor over the kinds of {@link RelationForm}.
 * @param <T> the result type
 */
@API(API.Status.STABLE)
public interface RelationFormVisitor<T> {
    T visitConstant(@Nonnull RelationForm.ConstantForm form);

    T visitGet(@Nonnull RelationForm.GetForm form);

    T visitLet(@Nonnull RelationForm.LetForm form);

    T visitMap(@Nonnull RelationForm.MapForm form);

    T visitFilter(@Nonnull RelationForm.FilterForm form);

    T visitArrangeBy(@Nonnull RelationForm.ArrangeByForm form);

    T visitJoin(@Nonnull RelationForm.JoinForm form);

    T visitReduce(@Nonnull RelationForm.ReduceForm form);

    T visitTopK(@Nonnull RelationForm.TopKForm form);
}
