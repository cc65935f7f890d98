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
package net.hydromatic.verity;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;
import java.util.function.Function;
import net.hydromatic.verity.eval.Nil;
import net.hydromatic.verity.eval.Prop;
import net.hydromatic.verity.report.Collector;
import net.hydromatic.verity.report.Diagnostic;
import net.hydromatic.verity.report.Tracer;
import net.hydromatic.verity.report.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A condition that must hold before a method is called (precondition),
 * after it returns (postcondition), or whenever an object is observed
 * (invariant).
 *
 * <p>Contracts are immutable. Methods such as {@link #withDescription} return
 * a copy with one attribute changed.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * Contract c = Contract.precondition("x &lt; 5");
 * c.check(ImmutableMap.of("x", 100));
 * </pre></blockquote>
 *
 * <p>throws a {@link ViolationException} with message "x &lt; 5: x was 100".
 *
 * <p>A postcondition may compare the state after a call with values that
 * its {@link Snapshot snapshots} captured before the call:
 *
 * <blockquote><pre>
 * Contract c = Contract.postcondition("len(OLD.lst) + 1 == len(lst)")
 *     .withSnapshot(Snapshot.of("lst[:]"));
 * OldValues old = c.capture(args);
 * lst.add(x);
 * c.checkResult(args, null, old);
 * </pre></blockquote>
 */
public class Contract {
  private static final Logger LOG = LoggerFactory.getLogger(Contract.class);

  /** Name to which {@link #checkResult} binds the result of a method. */
  public static final String RESULT = "result";

  /** Name to which {@link #checkResult(Map, Object, OldValues)} binds the
   * values captured by snapshots. */
  public static final String OLD = "OLD";

  public final Kind kind;
  public final Condition condition;
  public final @Nullable String description;
  /** Where the contract is declared, for example "MyClass.java:12"; printed
   * on the line before the diagnostic. */
  public final @Nullable String location;
  public final ImmutableList<Snapshot> snapshots;
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  /** Creates the exception thrown on violation, given its message; if null,
   * a {@link ViolationException} is thrown. */
  private final @Nullable Function<String, ? extends RuntimeException> error;

  private Contract(Kind kind, Condition condition, @Nullable String description,
      @Nullable String location, ImmutableList<Snapshot> snapshots,
      Map<Prop, Object> props, Tracer tracer,
      @Nullable Function<String, ? extends RuntimeException> error) {
    this.kind = requireNonNull(kind);
    this.condition = requireNonNull(condition);
    this.description = description;
    this.location = location;
    this.snapshots = requireNonNull(snapshots);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.error = error;
  }

  /** Creates a contract.
   *
   * @throws net.hydromatic.verity.report.UnsupportedExpressionException if
   * the condition contains a lambda */
  public static Contract of(Kind kind, Condition condition) {
    Collector.checkSupported(condition.exp);
    return new Contract(kind, condition, null, null, ImmutableList.of(),
        ImmutableMap.of(), Tracers.empty(), null);
  }

  /** Creates a precondition. */
  public static Contract precondition(String conditionText) {
    return of(Kind.PRECONDITION, Condition.parse(conditionText));
  }

  /** Creates a postcondition. Its condition may refer to {@code result}. */
  public static Contract postcondition(String conditionText) {
    return of(Kind.POSTCONDITION, Condition.parse(conditionText));
  }

  /** Creates an invariant. */
  public static Contract invariant(String conditionText) {
    return of(Kind.INVARIANT, Condition.parse(conditionText));
  }

  @Override public String toString() {
    return kind + "(" + condition + ")";
  }

  public Contract withDescription(@Nullable String description) {
    return new Contract(kind, condition, description, location, snapshots,
        props, tracer, error);
  }

  public Contract withLocation(@Nullable String location) {
    return new Contract(kind, condition, description, location, snapshots,
        props, tracer, error);
  }

  /** Returns a copy of this postcondition with an additional snapshot.
   *
   * @throws IllegalArgumentException if this contract is not a
   * postcondition, or already has a snapshot with the same name */
  public Contract withSnapshot(Snapshot snapshot) {
    if (kind != Kind.POSTCONDITION) {
      throw new IllegalArgumentException("snapshot " + snapshot
          + " requires a postcondition, but contract is " + kind);
    }
    for (Snapshot s : snapshots) {
      if (s.name.equals(snapshot.name)) {
        throw new IllegalArgumentException(
            "There are conflicting snapshots with the name '" + s.name + "'");
      }
    }
    return new Contract(kind, condition, description, location,
        ImmutableList.<Snapshot>builder().addAll(snapshots).add(snapshot)
            .build(),
        props, tracer, error);
  }

  /** Returns a copy of this contract with a property set. */
  public Contract withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(props);
    prop.set(map, value);
    return new Contract(kind, condition, description, location, snapshots,
        map, tracer, error);
  }

  /** Returns a copy of this contract with properties read from string
   * properties, such as {@link System#getProperties()}.
   *
   * <p>A key that starts with {@code prefix} names a {@link Prop} after the
   * prefix, either in camel case or upper case; for example, with prefix
   * "verity.", the keys "verity.printLength" and "verity.PRINT_LENGTH" both
   * set {@link Prop#PRINT_LENGTH}. Other keys are ignored.
   *
   * @throws IllegalArgumentException if a key names an unknown property, or
   * if a value is not valid for its property */
  public Contract withProperties(Properties properties, String prefix) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(props);
    for (String name : new TreeSet<>(properties.stringPropertyNames())) {
      if (name.startsWith(prefix)) {
        final Prop prop = Prop.lookup(name.substring(prefix.length()));
        prop.setLenient(map, properties.getProperty(name));
      }
    }
    return new Contract(kind, condition, description, location, snapshots,
        map, tracer, error);
  }

  public Contract withTracer(Tracer tracer) {
    return new Contract(kind, condition, description, location, snapshots,
        props, tracer, error);
  }

  /** Returns a copy of this contract that throws a different kind of
   * exception when violated. The function receives the message that a
   * {@link ViolationException} would have had; for example,
   * {@code withError(IllegalArgumentException::new)}. */
  public Contract withError(
      Function<String, ? extends RuntimeException> error) {
    return new Contract(kind, condition, description, location, snapshots,
        props, tracer, requireNonNull(error));
  }

  /** Returns whether this contract is checked; see {@link Prop#ENABLED}. */
  public boolean isEnabled() {
    return Prop.ENABLED.booleanValue(props);
  }

  /** Checks the condition against the values of variables.
   *
   * @throws ViolationException if the condition is false
   * @throws net.hydromatic.verity.eval.EvalException if the condition, or one
   * of its sub-expressions, cannot be evaluated
   */
  public void check(Map<String, ?> bindings) {
    if (!isEnabled()) {
      return;
    }
    LOG.trace("checking {}", this);
    if (condition.test(bindings)) {
      return;
    }
    final Diagnostic diagnostic =
        condition.diagnose(bindings, description, props, tracer);
    final String message = location == null
        ? diagnostic.message
        : location + ":\n" + diagnostic.message;
    LOG.debug("{} violated: {}", kind, message);
    if (error != null) {
      throw requireNonNull(error.apply(message),
          () -> "error function of " + this + " returned null");
    }
    throw new ViolationException(this, diagnostic, message);
  }

  /** Checks a postcondition against the arguments and result of a method.
   * The result is bound to {@link #RESULT}. */
  public void checkResult(Map<String, ?> bindings, @Nullable Object result) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>(bindings);
    map.put(RESULT, result);
    check(map);
  }

  /** Checks a postcondition against the arguments and result of a method,
   * and the values that {@link #capture} returned before the method was
   * called. The result is bound to {@link #RESULT}, and the captured values
   * to {@link #OLD}. */
  public void checkResult(Map<String, ?> bindings, @Nullable Object result,
      OldValues old) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>(bindings);
    map.put(RESULT, result);
    map.put(OLD, requireNonNull(old));
    check(map);
  }

  /** Evaluates this contract's snapshots against the arguments of a method,
   * before the method is called.
   *
   * @throws net.hydromatic.verity.eval.EvalException if a capture expression
   * cannot be evaluated
   */
  public OldValues capture(Map<String, ?> bindings) {
    if (!isEnabled() || snapshots.isEmpty()) {
      return OldValues.EMPTY;
    }
    final ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
    for (Snapshot snapshot : snapshots) {
      final Object value = snapshot.capture(bindings);
      LOG.trace("captured {} as {}", snapshot, value);
      values.put(snapshot.name, Nil.of(value));
    }
    return new OldValues(values.build());
  }

  /** Kind of contract. */
  public enum Kind {
    PRECONDITION,
    POSTCONDITION,
    INVARIANT
  }
}

// End Contract.java
