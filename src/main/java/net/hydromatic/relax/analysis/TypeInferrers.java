/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.relax.analysis;

import com.google.common.collect.ImmutableList;
import net.hydromatic.relax.ir.Op;
import net.hydromatic.relax.ir.Prim;
import net.hydromatic.relax.ir.Rx;
import net.hydromatic.relax.ir.RxBuilder;
import net.hydromatic.relax.type.FuncType;
import net.hydromatic.relax.type.PrimitiveType;
import net.hydromatic.relax.type.TensorType;
import net.hydromatic.relax.type.TupleType;
import net.hydromatic.relax.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link TypeInferrer}. */
public abstract class TypeInferrers {
  private TypeInferrers() {}

  /**
   * Returns a type inferrer that uses the annotations on each expression,
   * and derives the types of literals.
   */
  public static TypeInferrer annotated() {
    return AnnotatedTypeInferrer.INSTANCE;
  }

  /** Type inferrer that reads annotations. */
  private enum AnnotatedTypeInferrer implements TypeInferrer {
    INSTANCE;

    @Override
    public @Nullable Type inferType(Rx.Expr expr) {
      if (expr.checkedType != null) {
        return expr.checkedType;
      }
      switch (expr.op) {
      case CONSTANT:
        final Rx.Constant constant = (Rx.Constant) expr;
        return TensorType.of(constant.dims.size(), constant.dtype);

      case TUPLE:
        final ImmutableList.Builder<Type> fieldTypes = ImmutableList.builder();
        for (Rx.Expr field : ((Rx.Tuple) expr).fields) {
          final @Nullable Type fieldType = inferType(field);
          if (fieldType == null) {
            return null;
          }
          fieldTypes.add(fieldType);
        }
        return TupleType.of(fieldTypes.build());

      case TUPLE_GET_ITEM:
        final Rx.TupleGetItem getItem = (Rx.TupleGetItem) expr;
        final @Nullable Type tupleType = inferType(getItem.tuple);
        if (tupleType instanceof TupleType
            && getItem.index < ((TupleType) tupleType).fieldTypes.size()) {
          return tupleType.arg(getItem.index);
        }
        return null;

      case SHAPE_EXPR:
        return PrimitiveType.SHAPE;

      case FUNCTION:
        final Rx.Function function = (Rx.Function) expr;
        final ImmutableList.Builder<Type> paramTypes = ImmutableList.builder();
        for (Rx.Var param : function.params) {
          if (param.checkedType == null) {
            return null;
          }
          paramTypes.add(param.checkedType);
        }
        final @Nullable Type resultType =
            function.retType != null
                ? function.retType
                : inferType(function.body);
        return resultType == null
            ? null
            : FuncType.of(paramTypes.build(), resultType);

      default:
        return null;
      }
    }

    @Override
    public Rx.@Nullable Expr inferShape(Rx.Expr expr) {
      if (expr.shape != null) {
        return expr.shape;
      }
      if (expr.op == Op.CONSTANT) {
        final ImmutableList.Builder<Prim.Expr> dims = ImmutableList.builder();
        for (long dim : ((Rx.Constant) expr).dims) {
          dims.add(RxBuilder.rx.intImm(dim));
        }
        return RxBuilder.rx.shape(dims.build());
      }
      return null;
    }
  }
}

// End TypeInferrers.java
