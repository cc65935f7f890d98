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
package net.hydromatic.verity.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.verity.eval.EvalException.Kind.TYPE_ERROR;

import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Pos;

/** Value of a lambda expression: the lambda plus the environment in which it
 * was evaluated. */
public class Closure implements Applicable {
  private final Ast.Lambda lambda;
  private final EvalEnv evalEnv;
  private final Evaluator evaluator;

  Closure(Ast.Lambda lambda, EvalEnv evalEnv, Evaluator evaluator) {
    this.lambda = requireNonNull(lambda);
    this.evalEnv = requireNonNull(evalEnv);
    this.evaluator = requireNonNull(evaluator);
  }

  @Override public String toString() {
    return "Closure(" + lambda + ")";
  }

  @Override public Object apply(Pos pos, List<Object> args,
      Map<String, Object> keywords) {
    final List<Ast.IdPat> params = lambda.params;
    EvalEnv env = evalEnv;
    int i = 0;
    for (Ast.IdPat param : params) {
      final Object value;
      if (i < args.size()) {
        if (keywords.containsKey(param.name)) {
          throw new EvalException(TYPE_ERROR,
              "<lambda>() got multiple values for argument '" + param.name
                  + "'", pos);
        }
        value = args.get(i);
      } else if (keywords.containsKey(param.name)) {
        value = keywords.get(param.name);
      } else {
        throw new EvalException(TYPE_ERROR,
            "<lambda>() missing required argument: '" + param.name + "'",
            pos);
      }
      env = env.bind(param.name, value);
      ++i;
    }
    if (args.size() > params.size()) {
      throw new EvalException(TYPE_ERROR,
          "<lambda>() takes " + params.size() + " positional arguments but "
              + args.size() + " were given", pos);
    }
    for (String name : keywords.keySet()) {
      if (params.stream().noneMatch(p -> p.name.equals(name))) {
        throw new EvalException(TYPE_ERROR,
            "<lambda>() got an unexpected keyword argument '" + name + "'",
            pos);
      }
    }
    return evaluator.eval(env, lambda.body);
  }
}

// End Closure.java
