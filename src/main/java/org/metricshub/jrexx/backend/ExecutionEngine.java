package org.metricshub.jrexx.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jrexx
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.metricshub.jrexx.address.AddressDispatcher;
import org.metricshub.jrexx.address.AddressInvocation;
import org.metricshub.jrexx.address.AddressRegistration;
import org.metricshub.jrexx.address.AddressReply;
import org.metricshub.jrexx.address.AddressResult;
import org.metricshub.jrexx.address.AddressTargetRegistry;
import org.metricshub.jrexx.address.AuthContext;
import org.metricshub.jrexx.ext.ModuleCall;
import org.metricshub.jrexx.ext.ModuleLoadException;
import org.metricshub.jrexx.ext.ModuleLoader;
import org.metricshub.jrexx.ext.ModuleRegistry;
import org.metricshub.jrexx.frontend.LexerException;
import org.metricshub.jrexx.frontend.Program;
import org.metricshub.jrexx.frontend.RexxParser;
import org.metricshub.jrexx.frontend.ast.Expression;
import org.metricshub.jrexx.frontend.ast.Statement;
import org.metricshub.jrexx.jrt.BuiltinFunctions;
import org.metricshub.jrexx.jrt.ConditionInfo;
import org.metricshub.jrexx.jrt.ConditionType;
import org.metricshub.jrexx.jrt.NumericSettings;
import org.metricshub.jrexx.jrt.ParseTemplate;
import org.metricshub.jrexx.jrt.RexxCondition;
import org.metricshub.jrexx.jrt.RexxNumbers;
import org.metricshub.jrexx.jrt.RexxValue;
import org.metricshub.jrexx.jrt.VariablePool;
import org.metricshub.jrexx.util.RexxLogger;
import org.metricshub.jrexx.util.RexxSettings;
import org.slf4j.Logger;

/**
 * The interpreter proper. It walks the statements of a {@link Program} one
 * step at a time, keeping the whole execution state (call frames and their
 * block cursors) in explicit data structures.
 * <p>
 * A step runs one statement, or one phase of a loop. When a step needs the
 * result of a call that has not completed, {@link #run()} returns the journal
 * entry to wait for; running again replays the step, taking the results of
 * the calls it already made from the frame's {@link CallJournal}.
 * <p>
 * Instances are not thread-safe; {@link Execution} serializes access.
 */
final class ExecutionEngine {

	private static final Logger LOG = RexxLogger.getLogger(ExecutionEngine.class);

	private static final String SIGL = "SIGL";

	private final Program program;
	private final RexxSettings settings;
	private final AddressTargetRegistry targets;
	private final ModuleRegistry modules;
	private final ModuleLoader loader;
	private final AddressDispatcher dispatcher;
	private final ExpressionEvaluator evaluator;
	private final PrintStream out;
	private final List<CallFrame> frames = new ArrayList<CallFrame>();
	private final VariablePool mainPool = new VariablePool();
	private final Deque<String> dataStack = new ArrayDeque<String>();
	private boolean interpretBlocked;
	private boolean finished;
	private boolean exited;
	private RexxValue result;

	ExecutionEngine(
			Program program,
			RexxSettings settings,
			AddressTargetRegistry targets,
			ModuleRegistry modules,
			ModuleLoader loader) {
		this.program = program;
		this.settings = settings;
		this.targets = targets;
		this.modules = modules;
		this.loader = loader;
		this.dispatcher = new AddressDispatcher(settings.getCheckpointBroker(), settings.getCheckpointTimeout());
		this.evaluator = new ExpressionEvaluator(this, settings.getInterpolation());
		this.out = settings.getOutputStream();

		for (Map.Entry<String, Object> variable : settings.getVariables().entrySet()) {
			mainPool.set(variable.getKey(), RexxValue.fromObject(variable.getValue()));
		}
		List<RexxValue> arguments = new ArrayList<RexxValue>();
		for (String argument : settings.getArguments()) {
			arguments.add(RexxValue.of(argument));
		}
		NumericSettings numeric = new NumericSettings(settings.getDigits(), settings.getFuzz(), NumericSettings.Form.SCIENTIFIC);
		CallFrame main = CallFrame.main(arguments, mainPool, numeric);
		main.getCursors().push(new SequenceCursor(program.getStatements()));
		frames.add(main);
	}

	/**
	 * Runs until the script completes or has to wait.
	 *
	 * @return the journal entry the script waits for, or {@code null} once the
	 *         script has completed
	 * @throws RexxCondition when a condition is raised and not trapped
	 */
	CallJournal.Entry run() {
		while (!finished) {
			try {
				step();
			} catch (SuspendSignal e) {
				LOG.debug("Suspended on line {}", top().getLine());
				return e.getEntry();
			} catch (RoutineInvocation e) {
				enterRoutine(top(), CallFrame.Kind.FUNCTION, e.getRoutine(), e.getArguments(), e.getEntry(), e.getLine());
			} catch (RexxCondition e) {
				signal(e);
			}
		}
		return null;
	}

	boolean isFinished() {
		return finished;
	}

	/**
	 * @return {@code true} when the script ended with EXIT (or RETURN from the main program)
	 */
	boolean isExited() {
		return exited;
	}

	/**
	 * @return value of EXIT or RETURN, or {@code null}
	 */
	RexxValue getResult() {
		return result;
	}

	VariablePool getMainPool() {
		return mainPool;
	}

	private CallFrame top() {
		return frames.get(frames.size() - 1);
	}

	private void step() {
		CallFrame frame = top();
		BlockCursor cursor = frame.getCursors().peek();
		if (cursor == null) {
			leaveFrame(frame, null);
			return;
		}
		if (cursor instanceof SequenceCursor) {
			SequenceCursor sequence = (SequenceCursor) cursor;
			if (sequence.isExhausted()) {
				frame.getCursors().pop();
				return;
			}
			Statement statement = sequence.current();
			frame.setLine(statement.getLine());
			frame.getJournal().rewind();
			execute(statement, frame);
			sequence.advance();
		} else {
			LoopCursor loop = (LoopCursor) cursor;
			frame.setLine(loop.getStatement().getLine());
			frame.getJournal().rewind();
			if (loop.getPhase() == LoopCursor.Phase.CHECK) {
				checkLoop(loop, frame);
			} else {
				stepLoop(loop, frame);
			}
		}
		frame.getJournal().clear();
		frame.setProcedureAllowed(false);
	}

	private void execute(Statement statement, CallFrame frame) {
		switch (statement.getKind()) {
		case ASSIGNMENT: {
			Statement.Assignment assignment = (Statement.Assignment) statement;
			assign(frame.getPool(), assignment.target, evaluator.evaluate(assignment.value, frame));
			break;
		}
		case SAY: {
			RexxValue value = evaluator.evaluateOptional(((Statement.Say) statement).value, frame);
			out.println(value == null ? "" : value.asString());
			break;
		}
		case NOP:
		case LABEL:
			break;
		case DROP:
			drop(frame.getPool(), ((Statement.Drop) statement).names);
			break;
		case IF:
			executeIf((Statement.If) statement, frame);
			break;
		case DO:
			executeDo((Statement.Do) statement, frame);
			break;
		case LEAVE:
			leave(frame, ((Statement.Leave) statement).name);
			break;
		case ITERATE:
			iterate(frame, ((Statement.Iterate) statement).name);
			break;
		case SELECT:
			executeSelect((Statement.Select) statement, frame);
			break;
		case CALL: {
			Statement.Call call = (Statement.Call) statement;
			call(frame, call.name, evaluator.evaluateArguments(call.arguments, frame), call.getLine());
			break;
		}
		case FUNCTION_CALL: {
			Expression.FunctionCall call = ((Statement.FunctionCallStatement) statement).call;
			call(frame, call.name, evaluator.evaluateArguments(call.arguments, frame), call.getLine());
			break;
		}
		case PROCEDURE:
			procedure((Statement.Procedure) statement, frame);
			break;
		case RETURN:
			executeReturn(frame, evaluator.evaluateOptional(((Statement.Return) statement).value, frame));
			break;
		case EXIT:
			exit((Statement.Exit) statement, frame);
			break;
		case SIGNAL:
			executeSignal((Statement.Signal) statement, frame);
			break;
		case PARSE:
			parse((Statement.Parse) statement, frame);
			break;
		case ADDRESS:
			address((Statement.Address) statement, frame);
			break;
		case BARE_COMMAND:
			command((Statement.BareCommand) statement, frame);
			break;
		case OPERATION:
			operation((Statement.Operation) statement, frame);
			break;
		case REQUIRE:
			require((Statement.Require) statement, frame);
			break;
		case NUMERIC:
			numeric((Statement.Numeric) statement, frame);
			break;
		case INTERPRET:
			interpret((Statement.Interpret) statement, frame);
			break;
		case PUSH:
		case QUEUE:
			push((Statement.Push) statement, frame);
			break;
		case NO_INTERPRET:
			interpretBlocked = true;
			break;
		case TRACE:
			LOG.debug("Ignoring TRACE {} on line {}", ((Statement.Trace) statement).setting, statement.getLine());
			break;
		default:
			throw new IllegalStateException("Unsupported statement " + statement.getKind());
		}
	}

	// Variables

	private static void assign(VariablePool pool, Expression.Symbol target, RexxValue value) {
		switch (target.kind) {
		case SIMPLE:
			pool.setSimple(target.name, value);
			break;
		case STEM:
			pool.assignStem(target.name, value);
			break;
		case COMPOUND:
			pool.setCompound(target.stemName(), ExpressionEvaluator.deriveTail(target.tail(), pool), value);
			break;
		default:
			throw new IllegalStateException("Cannot assign to constant symbol " + target.name);
		}
	}

	private static void drop(VariablePool pool, List<Expression.Symbol> names) {
		for (Expression.Symbol symbol : names) {
			switch (symbol.kind) {
			case SIMPLE:
				pool.dropSimple(symbol.name);
				break;
			case STEM:
				pool.dropStem(symbol.name);
				break;
			case COMPOUND:
				pool.dropCompound(symbol.stemName(), ExpressionEvaluator.deriveTail(symbol.tail(), pool));
				break;
			default:
				break;
			}
		}
	}

	/**
	 * Value of an unset variable: its own name, unless NOVALUE is trapped or
	 * fatal.
	 *
	 * @param name upper-case derived name
	 * @return the name as a value
	 * @throws RexxCondition NOVALUE when trapped or fatal
	 */
	RexxValue novalue(String name) {
		if (settings.isNovalueFatal() || isTrapEnabled(ConditionType.NOVALUE)) {
			throw RexxCondition.novalue(name);
		}
		return RexxValue.of(name);
	}

	// Control flow

	private void executeIf(Statement.If statement, CallFrame frame) {
		boolean condition = evaluator.evaluate(statement.condition, frame).requireLogical();
		List<Statement> branch = condition ? statement.thenBranch : statement.elseBranch;
		if (branch != null && !branch.isEmpty()) {
			frame.getCursors().push(new SequenceCursor(branch));
		}
	}

	private void executeSelect(Statement.Select statement, CallFrame frame) {
		for (Statement.When when : statement.whens) {
			if (evaluator.evaluate(when.condition, frame).requireLogical()) {
				frame.getCursors().push(new SequenceCursor(when.body));
				return;
			}
		}
		if (statement.otherwise == null) {
			throw RexxCondition.syntax(RexxCondition.WHEN_EXPECTED, "No WHEN matched and there is no OTHERWISE");
		}
		frame.getCursors().push(new SequenceCursor(statement.otherwise));
	}

	private void executeDo(Statement.Do statement, CallFrame frame) {
		if (statement.isSimpleGroup()) {
			frame.getCursors().push(new SequenceCursor(statement.body));
			return;
		}
		NumericSettings numeric = frame.getNumeric();
		LoopCursor loop = new LoopCursor(statement);
		RexxValue start = null;
		if (statement.over != null) {
			loop.setItems(overItems(statement.over, frame));
		} else if (statement.control != null) {
			start = RexxValue.of(RexxNumbers.add(BigDecimal.ZERO, evaluator.evaluate(statement.initial, frame).requireNumber(), numeric), numeric);
			if (statement.to != null) {
				loop.setLimit(evaluator.evaluate(statement.to, frame).requireNumber());
			}
			if (statement.by != null) {
				loop.setIncrement(evaluator.evaluate(statement.by, frame).requireNumber());
			}
		}
		if (statement.forCount != null) {
			loop.limitIterations(count(evaluator.evaluate(statement.forCount, frame), numeric));
		}
		if (statement.repeat != null) {
			loop.limitIterations(count(evaluator.evaluate(statement.repeat, frame), numeric));
		}
		if (start != null) {
			assign(frame.getPool(), statement.control, start);
		}
		frame.getCursors().push(loop);
	}

	private List<String> overItems(Expression over, CallFrame frame) {
		if (over instanceof Expression.Symbol && ((Expression.Symbol) over).kind == Expression.Symbol.Kind.STEM) {
			return frame.getPool().stem(((Expression.Symbol) over).name).tails();
		}
		return BuiltinFunctions.words(evaluator.evaluate(over, frame).asString());
	}

	private static int count(RexxValue value, NumericSettings numeric) {
		int count = value.requireWholeNumber(numeric);
		if (count < 0) {
			throw RexxCondition.syntax(RexxCondition.INVALID_WHOLE_NUMBER, "Loop count must not be negative, got " + count);
		}
		return count;
	}

	private void checkLoop(LoopCursor loop, CallFrame frame) {
		Statement.Do statement = loop.getStatement();
		if (loop.isIterationLimitReached()) {
			frame.getCursors().pop();
			return;
		}
		if (loop.hasItems()) {
			String item = loop.peekItem();
			if (item == null) {
				frame.getCursors().pop();
				return;
			}
			assign(frame.getPool(), statement.control, RexxValue.of(item));
		} else if (loop.isCounting() && loop.getLimit() != null) {
			BigDecimal current = evaluator.evaluate(statement.control, frame).requireNumber();
			int comparison = RexxNumbers.compare(current, loop.getLimit(), frame.getNumeric());
			if (loop.getIncrement().signum() >= 0 ? comparison > 0 : comparison < 0) {
				frame.getCursors().pop();
				return;
			}
		}
		if (statement.whileCondition != null && !evaluator.evaluate(statement.whileCondition, frame).requireLogical()) {
			frame.getCursors().pop();
			return;
		}
		if (loop.hasItems()) {
			loop.nextItem();
		}
		loop.countIteration();
		loop.setPhase(LoopCursor.Phase.STEP);
		frame.getCursors().push(new SequenceCursor(statement.body));
	}

	private void stepLoop(LoopCursor loop, CallFrame frame) {
		Statement.Do statement = loop.getStatement();
		if (statement.untilCondition != null && evaluator.evaluate(statement.untilCondition, frame).requireLogical()) {
			frame.getCursors().pop();
			return;
		}
		if (loop.isCounting()) {
			NumericSettings numeric = frame.getNumeric();
			BigDecimal current = evaluator.evaluate(statement.control, frame).requireNumber();
			assign(frame.getPool(), statement.control, RexxValue.of(RexxNumbers.add(current, loop.getIncrement(), numeric), numeric));
		}
		loop.setPhase(LoopCursor.Phase.CHECK);
	}

	private static LoopCursor findLoop(CallFrame frame, String name, String instruction) {
		for (BlockCursor cursor : frame.getCursors()) {
			if (cursor instanceof LoopCursor && ((LoopCursor) cursor).matches(name)) {
				return (LoopCursor) cursor;
			}
		}
		throw RexxCondition
				.syntax(
						RexxCondition.INVALID_LEAVE,
						instruction + (name == null ? "" : " " + name) + " is not inside a matching repetitive DO loop");
	}

	private static void leave(CallFrame frame, String name) {
		LoopCursor loop = findLoop(frame, name, "LEAVE");
		Deque<BlockCursor> cursors = frame.getCursors();
		while (cursors.pop() != loop) {
			// unwind blocks nested in the loop
		}
	}

	private static void iterate(CallFrame frame, String name) {
		LoopCursor loop = findLoop(frame, name, "ITERATE");
		Deque<BlockCursor> cursors = frame.getCursors();
		while (cursors.peek() != loop) {
			cursors.pop();
		}
		loop.setPhase(LoopCursor.Phase.STEP);
	}

	private void executeSignal(Statement.Signal statement, CallFrame frame) {
		switch (statement.mode) {
		case ON:
			frame.getTraps().put(statement.condition, statement.label);
			break;
		case OFF:
			frame.getTraps().remove(statement.condition);
			break;
		default:
			frame.getPool().setSimple(SIGL, RexxValue.of(statement.getLine()));
			jump(frame, statement.label);
			break;
		}
	}

	private void jump(CallFrame frame, String label) {
		int index = program.labelIndex(label);
		if (index < 0) {
			throw RexxCondition.syntax(RexxCondition.LABEL_NOT_FOUND, "Label " + label + " not found");
		}
		frame.getCursors().clear();
		frame.getCursors().push(new SequenceCursor(program.getStatements(), index));
	}

	private void interpret(Statement.Interpret statement, CallFrame frame) {
		if (interpretBlocked) {
			throw RexxCondition.syntax(RexxCondition.INTERPRETATION, "INTERPRET is blocked by NO-INTERPRET");
		}
		String code = evaluator.evaluate(statement.code, frame).asString();
		List<Statement> statements;
		try {
			statements = new RexxParser(code, program.getDescription() + " (INTERPRET)").parseStatements();
		} catch (LexerException e) {
			throw new RexxCondition(ConditionType.SYNTAX, RexxCondition.INTERPRETATION, "INTERPRET failed: " + e.getMessage(), e);
		}
		frame.getCursors().push(new SequenceCursor(statements));
	}

	private void numeric(Statement.Numeric statement, CallFrame frame) {
		NumericSettings numeric = frame.getNumeric();
		switch (statement.setting) {
		case DIGITS:
			numeric
					.setDigits(
							statement.value == null ?
									NumericSettings.DEFAULT_DIGITS : evaluator.evaluate(statement.value, frame).requireWholeNumber(numeric));
			break;
		case FUZZ:
			numeric.setFuzz(statement.value == null ? 0 : evaluator.evaluate(statement.value, frame).requireWholeNumber(numeric));
			break;
		default:
			numeric
					.setForm(
							statement.form == null ?
									NumericSettings.Form.SCIENTIFIC : NumericSettings.Form.valueOf(statement.form.toUpperCase(Locale.ROOT)));
			break;
		}
	}

	// Data stack

	private void push(Statement.Push statement, CallFrame frame) {
		RexxValue value = evaluator.evaluateOptional(statement.value, frame);
		String line = value == null ? "" : value.asString();
		if (statement.queue) {
			dataStack.addLast(line);
		} else {
			dataStack.addFirst(line);
		}
	}

	// PARSE

	private void parse(Statement.Parse statement, CallFrame frame) {
		List<String> sources = new ArrayList<String>();
		switch (statement.source) {
		case ARG:
			for (RexxValue argument : frame.getArguments()) {
				sources.add(argument == null ? "" : argument.asString());
			}
			break;
		case VAR:
			sources.add(evaluator.evaluate(statement.variable, frame).asString());
			break;
		case PULL: {
			String line = dataStack.pollFirst();
			sources.add(line == null ? "" : line);
			break;
		}
		default: {
			RexxValue value = evaluator.evaluateOptional(statement.value, frame);
			sources.add(value == null ? "" : value.asString());
			break;
		}
		}
		ParseTemplate.Binding binding = binding(frame);
		for (int i = 0; i < statement.templates.size(); i++) {
			String source = i < sources.size() ? sources.get(i) : "";
			if (statement.upper) {
				source = source.toUpperCase(Locale.ROOT);
			}
			statement.templates.get(i).apply(source, binding);
		}
	}

	private ParseTemplate.Binding binding(final CallFrame frame) {
		return new ParseTemplate.Binding() {
			@Override
			public void assign(String name, String value) {
				ExecutionEngine.assign(frame.getPool(), new Expression.Symbol(frame.getLine(), name), RexxValue.of(value));
			}

			@Override
			public String lookup(String name) {
				RexxValue value = ExpressionEvaluator.lookup(name, frame.getPool());
				return value != null ? value.asString() : novalue(name).asString();
			}
		};
	}

	// Routines

	/**
	 * Resolves and calls a function from an expression: internal routine,
	 * built-in function, module function, then method of the active ADDRESS
	 * target.
	 *
	 * @param frame calling frame
	 * @param name upper-case function name
	 * @param args evaluated arguments
	 * @param line line of the call
	 * @return the function result
	 */
	RexxValue callFunction(CallFrame frame, String name, List<RexxValue> args, int line) {
		if (program.hasLabel(name)) {
			CallJournal.Entry entry = frame.getJournal().next();
			if (entry == null) {
				entry = frame.getJournal().record(new CompletableFuture<Object>(), null);
				throw new RoutineInvocation(name, args, entry, line);
			}
			return (RexxValue) replay(entry);
		}
		if (BuiltinFunctions.isBuiltin(name)) {
			return BuiltinFunctions.call(name, args, ExpressionEvaluator.context(frame, dataStack));
		}
		ModuleRegistry.Entry function = modules.function(name);
		if (function != null) {
			RexxValue value = invokeModule(frame, function, args, Collections.<String, RexxValue> emptyMap());
			if (value == null) {
				throw RexxCondition.syntax(RexxCondition.NO_RETURN_DATA, "Function " + name + " did not return data");
			}
			return value;
		}
		AddressRegistration target = methodTarget(frame);
		if (target != null) {
			AddressResult addressResult = dispatch(frame, target, frame.getAuth(), AddressInvocation.Kind.METHOD, name, positional(args, null));
			publish(frame, addressResult, name);
			return RexxValue.of(addressResult.getOutput());
		}
		throw RexxCondition.syntax(RexxCondition.ROUTINE_NOT_FOUND, "Routine " + name + " not found");
	}

	/**
	 * <code>CALL name</code> and <code>name(args)</code> as an instruction: the
	 * result goes to RESULT instead of an expression.
	 */
	private void call(CallFrame frame, String name, List<RexxValue> args, int line) {
		VariablePool pool = frame.getPool();
		if (program.hasLabel(name)) {
			enterRoutine(frame, CallFrame.Kind.CALL, name, args, null, line);
			return;
		}
		if (BuiltinFunctions.isBuiltin(name)) {
			setResult(pool, BuiltinFunctions.call(name, args, ExpressionEvaluator.context(frame, dataStack)));
			return;
		}
		ModuleRegistry.Entry entry = modules.function(name);
		if (entry == null) {
			entry = modules.operation(name);
		}
		if (entry != null) {
			setResult(pool, invokeModule(frame, entry, args, Collections.<String, RexxValue> emptyMap()));
			return;
		}
		AddressRegistration target = methodTarget(frame);
		if (target != null) {
			publish(frame, dispatch(frame, target, frame.getAuth(), AddressInvocation.Kind.METHOD, name, positional(args, null)), name);
			return;
		}
		throw RexxCondition.syntax(RexxCondition.ROUTINE_NOT_FOUND, "Routine " + name + " not found");
	}

	private void operation(Statement.Operation statement, CallFrame frame) {
		Map<String, RexxValue> named = new LinkedHashMap<String, RexxValue>();
		for (Map.Entry<String, Expression> argument : statement.namedArguments.entrySet()) {
			named.put(argument.getKey(), evaluator.evaluate(argument.getValue(), frame));
		}
		List<RexxValue> args = evaluator.evaluateArguments(statement.positionalArguments, frame);
		ModuleRegistry.Entry entry = modules.operation(statement.name);
		if (entry == null) {
			entry = modules.function(statement.name);
		}
		if (entry != null) {
			setResult(frame.getPool(), invokeModule(frame, entry, args, named));
			return;
		}
		AddressRegistration target = methodTarget(frame);
		if (target != null) {
			AddressResult addressResult = dispatch(
					frame,
					target,
					frame.getAuth(),
					AddressInvocation.Kind.METHOD,
					statement.name,
					positional(args, named));
			publish(frame, addressResult, statement.name);
			return;
		}
		if (named.isEmpty() && (program.hasLabel(statement.name) || BuiltinFunctions.isBuiltin(statement.name))) {
			call(frame, statement.name, args, statement.getLine());
			return;
		}
		throw RexxCondition.syntax(RexxCondition.ROUTINE_NOT_FOUND, "Operation " + statement.name + " not found");
	}

	private void enterRoutine(CallFrame caller, CallFrame.Kind kind, String name, List<RexxValue> args, CallJournal.Entry entry, int line) {
		int index = program.labelIndex(name) + 1;
		List<Statement> statements = program.getStatements();
		while (index < statements.size() && statements.get(index).getKind() == Statement.Kind.LABEL) {
			index++;
		}
		CallFrame frame = caller.routine(kind, name, args, entry);
		frame.getPool().setSimple(SIGL, RexxValue.of(line));
		frame.getCursors().push(new SequenceCursor(statements, index));
		frames.add(frame);
		LOG.trace("Entering routine {} from line {}", name, line);
	}

	private void procedure(Statement.Procedure statement, CallFrame frame) {
		if (frame.getKind() == CallFrame.Kind.MAIN || !frame.isProcedureAllowed()) {
			throw RexxCondition.syntax(RexxCondition.UNEXPECTED_PROCEDURE, "PROCEDURE must be the first instruction of a routine");
		}
		VariablePool caller = frame.getCallerPool();
		VariablePool own = frame.getPool();
		for (String name : statement.exposed) {
			int dot = name.indexOf('.');
			own.expose(caller, dot < 0 ? name : name.substring(0, dot + 1));
		}
	}

	private void executeReturn(CallFrame frame, RexxValue value) {
		if (frame.getKind() == CallFrame.Kind.MAIN) {
			finish(value);
			return;
		}
		leaveFrame(frame, value);
	}

	private void leaveFrame(CallFrame frame, RexxValue value) {
		if (frame.getKind() == CallFrame.Kind.MAIN) {
			finished = true;
			result = value;
			return;
		}
		frames.remove(frames.size() - 1);
		CallFrame caller = top();
		LOG.trace("Leaving routine {}", frame.getRoutineName());
		if (frame.getKind() == CallFrame.Kind.CALL) {
			setResult(caller.getPool(), value);
		} else if (value == null) {
			throw RexxCondition
					.syntax(RexxCondition.NO_RETURN_DATA, "Function " + frame.getRoutineName() + " did not return data")
					.locate(program.getDescription(), caller.getLine());
		} else {
			frame.getResultEntry().complete(value);
		}
	}

	private void exit(Statement.Exit statement, CallFrame frame) {
		if (statement.unless != null && evaluator.evaluate(statement.unless, frame).requireLogical()) {
			return;
		}
		RexxValue value = evaluator.evaluateOptional(statement.value, frame);
		if (statement.message != null) {
			out.println(evaluator.evaluate(statement.message, frame).asString());
		}
		finish(statement.unless != null && value == null ? RexxValue.of(0) : value);
	}

	private void finish(RexxValue value) {
		finished = true;
		exited = true;
		result = value;
	}

	private static void setResult(VariablePool pool, RexxValue value) {
		if (value == null) {
			pool.dropSimple(AddressDispatcher.RESULT);
		} else {
			pool.setSimple(AddressDispatcher.RESULT, value);
		}
	}

	private RexxValue invokeModule(CallFrame frame, ModuleRegistry.Entry entry, List<RexxValue> args, Map<String, RexxValue> named) {
		CallJournal journal = frame.getJournal();
		CallJournal.Entry recorded = journal.next();
		if (recorded != null) {
			return (RexxValue) replay(recorded);
		}
		Object value;
		try {
			value = entry.getCallable().invoke(new ModuleCall(entry.getName(), args, named, frame.getNumeric().copy()));
		} catch (RexxCondition e) {
			throw e;
		} catch (Exception e) {
			LOG.debug("Module call {} failed", entry.getName(), e);
			String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
			throw new RexxCondition(
					ConditionType.SYNTAX,
					RexxCondition.INCORRECT_CALL,
					"Incorrect call to " + entry.getName() + ": " + message,
					e);
		}
		RexxValue converted = value == null ? null : RexxValue.fromObject(value);
		journal.record(CompletableFuture.completedFuture(converted), null);
		return converted;
	}

	private static Object replay(CallJournal.Entry entry) {
		if (!entry.isDone()) {
			throw new SuspendSignal(entry);
		}
		return entry.value();
	}

	// ADDRESS

	private void address(Statement.Address statement, CallFrame frame) {
		switch (statement.mode) {
		case RESET:
			frame.selectAddress(null, null);
			break;
		case SWITCH: {
			AddressRegistration registration = resolveTarget(statement.target);
			AuthContext auth = statement.auth == null ? null : new AuthContext(evaluator.evaluate(statement.auth, frame).asString());
			if (statement.alias != null) {
				AddressRegistration alias = targets.registerAlias(statement.alias, registration, auth);
				frame.selectAddress(alias.getName(), null);
			} else {
				frame.selectAddress(registration.getName(), auth);
			}
			break;
		}
		default: {
			AddressRegistration registration = resolveTarget(statement.target);
			String command = evaluator.evaluate(statement.command, frame).asString();
			AddressResult addressResult = dispatch(
					frame,
					registration,
					null,
					AddressInvocation.Kind.COMMAND,
					command,
					commandParameters(command));
			publish(frame, addressResult, command);
			break;
		}
		}
	}

	private void command(Statement.BareCommand statement, CallFrame frame) {
		String command = evaluator.evaluate(statement.command, frame).asString();
		if (frame.getAddressName() == null) {
			out.println(command);
			return;
		}
		AddressRegistration registration = resolveTarget(frame.getAddressName());
		AddressResult addressResult = dispatch(
				frame,
				registration,
				frame.getAuth(),
				AddressInvocation.Kind.COMMAND,
				command,
				commandParameters(command));
		publish(frame, addressResult, command);
	}

	private AddressRegistration resolveTarget(String name) {
		AddressRegistration registration = targets.resolve(name);
		if (registration == null) {
			throw RexxCondition.syntax(RexxCondition.UNRESOLVED_TARGET, "ADDRESS target " + name + " is not registered");
		}
		return registration;
	}

	private AddressRegistration methodTarget(CallFrame frame) {
		if (frame.getAddressName() == null) {
			return null;
		}
		AddressRegistration registration = targets.resolve(frame.getAddressName());
		return registration != null && registration.getTarget().supportsMethodCall() ? registration : null;
	}

	private static Map<String, RexxValue> commandParameters(String command) {
		Map<String, RexxValue> parameters = new LinkedHashMap<String, RexxValue>();
		parameters.put(AddressInvocation.COMMAND_PARAMETER, RexxValue.of(command));
		return parameters;
	}

	private static Map<String, RexxValue> positional(List<RexxValue> args, Map<String, RexxValue> named) {
		Map<String, RexxValue> parameters = new LinkedHashMap<String, RexxValue>();
		if (named != null) {
			parameters.putAll(named);
		}
		for (int i = 0; i < args.size(); i++) {
			if (args.get(i) != null) {
				parameters.put("arg" + (i + 1), args.get(i));
			}
		}
		return parameters;
	}

	private AddressResult dispatch(
			CallFrame frame,
			AddressRegistration registration,
			AuthContext auth,
			AddressInvocation.Kind kind,
			String name,
			Map<String, RexxValue> parameters) {
		CallJournal journal = frame.getJournal();
		CallJournal.Entry entry = journal.next();
		if (entry == null) {
			AddressReply reply = dispatcher
					.dispatch(registration, auth, kind, name, parameters, frame.getPool().snapshot(), frame.getLine());
			entry = journal.record(reply.getCompletion(), reply.getCheckpoint());
		}
		return (AddressResult) replay(entry);
	}

	/**
	 * Publishes RC, RESULT and ERRORTEXT, then raises ERROR or FAILURE when
	 * the call failed and the condition is trapped.
	 */
	private void publish(CallFrame frame, AddressResult addressResult, String description) {
		AddressDispatcher.publish(addressResult, frame.getPool());
		if (addressResult.isSuccess()) {
			return;
		}
		ConditionType type = addressResult.isUnavailable() ? ConditionType.FAILURE : ConditionType.ERROR;
		LOG.debug("ADDRESS call on line {} failed with RC {}: {}", frame.getLine(), addressResult.getStatus(), addressResult.getError());
		if (isTrapEnabled(type)) {
			String error = addressResult.getError() == null ? "" : addressResult.getError();
			throw new RexxCondition(type, addressResult.getStatus(), error, description);
		}
	}

	// Modules

	private void require(Statement.Require statement, CallFrame frame) {
		String specifier = evaluator.evaluate(statement.specifier, frame).asString();
		try {
			loader.load(specifier, statement.as, settings);
		} catch (ModuleLoadException e) {
			throw new RexxCondition(
					ConditionType.SYNTAX,
					RexxCondition.SYSTEM_SERVICE,
					"Cannot load module " + specifier + ": " + e.getMessage(),
					e);
		}
	}

	// Conditions

	private static ConditionType[] handlers(ConditionType type) {
		switch (type) {
		case SYNTAX:
			return new ConditionType[] { ConditionType.SYNTAX, ConditionType.ERROR };
		case FAILURE:
			return new ConditionType[] { ConditionType.FAILURE, ConditionType.ERROR };
		default:
			return new ConditionType[] { type };
		}
	}

	/**
	 * @return {@code true} when a frame of the stack traps the condition
	 */
	boolean isTrapEnabled(ConditionType type) {
		for (CallFrame frame : frames) {
			for (ConditionType handler : handlers(type)) {
				if (frame.getTraps().containsKey(handler)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Transfers control to the innermost trap of the condition. The frames
	 * above the trapping one are discarded and the trap is disabled.
	 *
	 * @throws RexxCondition when no frame traps the condition
	 */
	private void signal(RexxCondition raised) {
		RexxCondition condition = raised;
		while (true) {
			condition.locate(program.getDescription(), top().getLine());
			int frameIndex = -1;
			ConditionType handler = null;
			for (int i = frames.size() - 1; i >= 0 && frameIndex < 0; i--) {
				for (ConditionType candidate : handlers(condition.getType())) {
					if (frames.get(i).getTraps().containsKey(candidate)) {
						frameIndex = i;
						handler = candidate;
						break;
					}
				}
			}
			if (frameIndex < 0) {
				LOG.debug("Untrapped condition: {}", condition.report());
				throw condition;
			}
			while (frames.size() > frameIndex + 1) {
				frames.remove(frames.size() - 1);
			}
			CallFrame frame = frames.get(frameIndex);
			String label = frame.getTraps().remove(handler);
			frame.getCursors().clear();
			frame.getJournal().clear();

			VariablePool pool = frame.getPool();
			String message = condition.getMessage() == null ? "" : condition.getMessage();
			if (condition.getType().setsReturnCode()) {
				pool.setSimple(AddressDispatcher.RC, RexxValue.of(condition.getCode()));
			}
			pool.setSimple(AddressDispatcher.ERRORTEXT, RexxValue.of(message));
			pool.setSimple(SIGL, RexxValue.of(condition.getLineNumber()));
			frame.setLastCondition(new ConditionInfo(condition.getType(), condition.getDescription(), message));
			LOG.debug("{} trapped by SIGNAL ON {} NAME {}", condition.report(), handler, label);

			int index = program.labelIndex(label);
			if (index < 0) {
				condition = RexxCondition.syntax(RexxCondition.LABEL_NOT_FOUND, "Label " + label + " not found");
				continue;
			}
			frame.getCursors().push(new SequenceCursor(program.getStatements(), index));
			return;
		}
	}
}
