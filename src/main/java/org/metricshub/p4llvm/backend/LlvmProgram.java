package org.metricshub.p4llvm.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * P4LLVM
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

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.EntityNotFoundException;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.ControlFlowNodeVisitor;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.hlir.P4Action;
import org.metricshub.p4llvm.hlir.P4ConditionalNode;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.hlir.P4Counter;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;
import org.metricshub.p4llvm.hlir.P4Node;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.intermediate.NameRegistry;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;
import org.metricshub.p4llvm.util.P4Logger;
import org.slf4j.Logger;

/**
 * The lowering of one HLIR program.
 * <p>
 * The constructor classifies the header instances and builds one code
 * generation unit per parse state, table, conditional, action and counter.
 * {@link #generate(ProgramSerializer)} then emits the whole program: types,
 * tables, and a single function running the parser, the ingress and egress
 * pipelines linearized into labeled blocks, and the deparser.
 * <p>
 * A program owns its {@link NameRegistry}: generated names are unique within
 * a program, and labels are stable once assigned. Instances are not
 * thread-safe.
 */
public class LlvmProgram {

	private static final Logger LOGGER = P4Logger.getLogger(LlvmProgram.class);

	private static final Logger WARNINGS = P4Logger.getWarningLogger();

	/** Prefix of every name the generated program reserves for itself. */
	public static final String RESERVED_PREFIX = "llvm_";

	/** License of the generated program. */
	public static final String LICENSE = "MIT";

	/** Metadata field holding the output port of a packet. */
	public static final String EGRESS_PORT_FIELD = "egress_port";

	private final String name;
	private final Hlir hlir;
	private final NameRegistry names = new NameRegistry();
	private final LlvmTypeFactory typeFactory = new LlvmTypeFactory();

	private final String packetName = RESERVED_PREFIX + "packet";
	private final String packetSizeName = RESERVED_PREFIX + "packetSize";
	private final String dropBit = RESERVED_PREFIX + "drop";
	private final String offsetVariable = RESERVED_PREFIX + "packetOffsetInBits";
	private final String zeroKeyName = RESERVED_PREFIX + "zero";
	private final String errorName = RESERVED_PREFIX + "error";
	private final String functionName = RESERVED_PREFIX + "filter";
	private final String actionDataName = RESERVED_PREFIX + "actionData";
	private final String headersStructTypeName = RESERVED_PREFIX + "headers_t";
	private final String headerStructName = RESERVED_PREFIX + "headers";
	private final String metadataStructTypeName = RESERVED_PREFIX + "metadata_t";
	private final String metadataStructName = RESERVED_PREFIX + "metadata";

	private final List<LlvmHeader> headers = new ArrayList<LlvmHeader>();
	private final List<LlvmMetadata> metadata = new ArrayList<LlvmMetadata>();
	private final List<LlvmHeaderStack> stacks = new ArrayList<LlvmHeaderStack>();
	private final List<LlvmParser> parsers = new ArrayList<LlvmParser>();
	private final List<LlvmTable> tables = new ArrayList<LlvmTable>();
	private final List<LlvmConditional> conditionals = new ArrayList<LlvmConditional>();
	private final List<LlvmAction> actions = new ArrayList<LlvmAction>();
	private final List<LlvmCounter> counters = new ArrayList<LlvmCounter>();
	private final List<P4ControlFlowNode> entryPoints = new ArrayList<P4ControlFlowNode>();
	private P4ControlFlowNode egressEntry;
	private LlvmDeparser deparser;
	private String egressPortExpression;

	private final Map<ErrorCode, String> errorLabels = new EnumMap<ErrorCode, String>(ErrorCode.class);
	private List<P4ControlFlowNode> ingressOrder = Collections.emptyList();
	private List<P4ControlFlowNode> egressOrder = Collections.emptyList();
	private int warningCount;

	private final ControlFlowNodeVisitor<ControlFlowUnit> unitResolver = new ControlFlowNodeVisitor<ControlFlowUnit>() {
		@Override
		public ControlFlowUnit visitTable(P4Table table) {
			return getTable(table.getName());
		}

		@Override
		public ControlFlowUnit visitConditional(P4ConditionalNode conditional) {
			return getConditional(conditional.getName());
		}
	};

	/**
	 * Builds the code generation units of a program.
	 *
	 * @param name name of the program, shown in the generated code
	 * @param hlir the program to lower
	 * @throws NotSupportedException if the program uses a construct the
	 *         backend does not translate
	 * @throws CompilationException if the program is inconsistent
	 */
	public LlvmProgram(String name, Hlir hlir) {
		this.name = name;
		this.hlir = hlir;
		construct();
	}

	private void construct() {
		LOGGER.debug("Constructing program {}", name);
		if (!hlir.getFieldListCalculations().isEmpty()) {
			throw new NotSupportedException("calculated field", hlir.getFieldListCalculations().get(0).getName());
		}

		List<String> instanceNames = new ArrayList<String>();
		for (P4HeaderInstance instance : hlir.getHeaderInstances()) {
			instanceNames.add(instance.getName());
		}
		checkUnique("header instance", instanceNames);
		List<String> stateNames = new ArrayList<String>();
		for (P4ParseState state : hlir.getParseStates()) {
			stateNames.add(state.getName());
		}
		checkUnique("parse state", stateNames);
		List<String> tableNames = new ArrayList<String>();
		for (P4Table table : hlir.getTables()) {
			tableNames.add(table.getName());
		}
		checkUnique("table", tableNames);
		List<String> conditionalNames = new ArrayList<String>();
		for (P4ConditionalNode conditional : hlir.getConditionals()) {
			conditionalNames.add(conditional.getName());
		}
		checkUnique("conditional", conditionalNames);
		List<String> actionNames = new ArrayList<String>();
		for (P4Action action : hlir.getActions()) {
			actionNames.add(action.getName());
		}
		checkUnique("action", actionNames);
		List<String> counterNames = new ArrayList<String>();
		for (P4Counter counter : hlir.getCounters()) {
			counterNames.add(counter.getName());
		}
		checkUnique("counter", counterNames);

		for (P4HeaderInstance instance : hlir.getHeaderInstances()) {
			if (instance.getMaxIndex() != null) {
				if (instance.getIndex() == 0) {
					String indexVariable = freshName(instance.getBaseName() + "_index");
					stacks.add(new LlvmHeaderStack(instance, headerStructName, indexVariable, typeFactory));
				}
			} else if (instance.isMetadata()) {
				metadata.add(new LlvmMetadata(instance, metadataStructName, typeFactory));
			} else {
				headers.add(new LlvmHeader(instance, headerStructName, typeFactory));
			}
		}

		for (P4ParseState state : hlir.getParseStates()) {
			parsers.add(new LlvmParser(state));
		}
		for (P4ParseState state : hlir.getParseStates()) {
			for (P4Node target : state.getTransitions().values()) {
				if (target instanceof P4ParseState && getParser(target.getName()).getParseState() != target) {
					throw new CompilationException(true, "Parse state {0} is not the one declared under that name", target);
				}
			}
		}
		if (hlir.getStartState() != null && getParser(hlir.getStartState().getName()).getParseState() != hlir.getStartState()) {
			throw new CompilationException(true, "Start state {0} is not the one declared under that name", hlir.getStartState());
		}

		entryPoints.addAll(hlir.getIngressEntryPoints());
		egressEntry = hlir.getEgressEntry();

		for (P4ConditionalNode conditional : hlir.getConditionals()) {
			conditionals.add(new LlvmConditional(conditional, this));
		}
		for (P4Action action : hlir.getActions()) {
			actions.add(new LlvmAction(action, this));
		}
		for (P4Counter counter : hlir.getCounters()) {
			counters.add(new LlvmCounter(counter));
		}
		for (P4Table table : hlir.getTables()) {
			tables.add(new LlvmTable(table, this));
		}

		deparser = new LlvmDeparser(hlir.getDeparseOrder(), this);
		egressPortExpression = findEgressPort();
	}

	private void checkUnique(String kind, List<String> entityNames) {
		Set<String> seen = new HashSet<String>();
		for (String entityName : entityNames) {
			if (!seen.add(entityName)) {
				throw new CompilationException(false, "Duplicate {0} named {1}", kind, entityName);
			}
		}
	}

	private String findEgressPort() {
		for (LlvmMetadata candidate : metadata) {
			if (candidate.getHeaderType().getFieldWidth(EGRESS_PORT_FIELD) != null) {
				return candidate.getAccessPath() + "." + EGRESS_PORT_FIELD;
			}
		}
		emitWarning("No metadata field named {0}, packets leave on port 0", EGRESS_PORT_FIELD);
		return "0";
	}

	/**
	 * Tells whether an action was injected by the compiler rather than
	 * written in the source, from its negative line number. The heuristic is
	 * only used for diagnostics.
	 *
	 * @param action an action
	 * @return {@code true} for compiler-injected actions
	 */
	public static boolean isInternalAction(P4Action action) {
		return action.getLineNumber() < 0;
	}

	/**
	 * @param instance a header instance
	 * @return {@code true} if the instance is an element of a header stack
	 */
	public static boolean isArrayElementInstance(P4HeaderInstance instance) {
		return instance.getMaxIndex() != null;
	}

	/**
	 * Reports a problem that does not prevent the compilation.
	 *
	 * @param format {@link MessageFormat} pattern
	 * @param arguments pattern arguments
	 */
	public void emitWarning(String format, Object... arguments) {
		warningCount++;
		WARNINGS.warn("{}: {}", name, MessageFormat.format(format, arguments));
	}

	public int getWarningCount() {
		return warningCount;
	}

	/**
	 * @see NameRegistry#freshName(String)
	 */
	public String freshName(String base) {
		return names.freshName(base);
	}

	/**
	 * @see NameRegistry#labelFor(P4Node)
	 */
	public String getLabel(P4Node node) {
		return names.labelFor(node);
	}

	public NameRegistry getNames() {
		return names;
	}

	/**
	 * @param code a parse error
	 * @return the label of the block raising the error, created on first use
	 */
	String getErrorLabel(ErrorCode code) {
		String label = errorLabels.get(code);
		if (label == null) {
			label = freshName("parse_error_" + code.name().toLowerCase(Locale.ROOT));
			errorLabels.put(code, label);
		}
		return label;
	}

	/**
	 * @param expression an expression outside of any action
	 * @return the expression in the generated program
	 */
	public String translate(P4Expression expression) {
		return new ExpressionTranslator(this, null).translate(expression);
	}

	/**
	 * @param instanceName header or metadata name, or stack element {@code base[index]}
	 * @param field field name
	 * @return the expression designating the field
	 */
	public String getFieldAccess(String instanceName, String field) {
		LlvmInstance instance = resolveInstance(instanceName);
		instance.getFieldType(field);
		return getInstanceAccess(instanceName) + "." + field;
	}

	/**
	 * @param instanceName header or metadata name, or stack element {@code base[index]}
	 * @return the expression designating the instance
	 */
	public String getInstanceAccess(String instanceName) {
		int bracket = instanceName.indexOf('[');
		if (bracket >= 0 && instanceName.endsWith("]")) {
			String index = instanceName.substring(bracket + 1, instanceName.length() - 1);
			return getStackInstance(instanceName.substring(0, bracket)).getElementAccess(index);
		}
		return getInstance(instanceName).getAccessPath();
	}

	/**
	 * @param field a field reference
	 * @return the width of the field, in bits
	 */
	public int getFieldWidth(P4Expression.FieldRef field) {
		return resolveInstance(field.getInstance()).getFieldType(field.getField()).getWidthInBits();
	}

	private LlvmInstance resolveInstance(String instanceName) {
		int bracket = instanceName.indexOf('[');
		if (bracket >= 0 && instanceName.endsWith("]")) {
			return getStackInstance(instanceName.substring(0, bracket));
		}
		return getInstance(instanceName);
	}

	/**
	 * Emits the whole program.
	 *
	 * @param serializer where to emit
	 */
	public void generate(ProgramSerializer serializer) {
		LOGGER.debug("Generating program {}", name);
		serializer.comment("Program " + name + ", license " + LICENSE);
		generateTypes(serializer);
		generateTables(serializer);

		serializer.beginFunction(
				"int",
				functionName,
				Arrays.asList("uint8_t *" + packetName, "uint32_t " + packetSizeName));
		generateVariables(serializer);
		generateInitializeHeaders(serializer);
		generateInitializeMetadata(serializer);
		generateParser(serializer);
		generatePipeline(serializer);
		generateErrorHandlers(serializer);
		serializer.label(getLabel(null));
		generateDeparser(serializer);
		serializer.endFunction();
	}

	/**
	 * Emits the error enumeration, the header and metadata types, and the
	 * action parameter structs.
	 */
	public void generateTypes(ProgramSerializer serializer) {
		serializer.declareEnum(ErrorCode.ENUM_NAME, ErrorCode.generatedNames());

		List<LlvmInstance> headerInstances = new ArrayList<LlvmInstance>();
		headerInstances.addAll(headers);
		headerInstances.addAll(stacks);
		Set<String> declared = new HashSet<String>();
		for (LlvmInstance instance : headerInstances) {
			if (declared.add(instance.getHeaderType().getName())) {
				instance.declareType(serializer);
			}
		}
		for (LlvmInstance instance : metadata) {
			if (declared.add(instance.getHeaderType().getName())) {
				instance.declareType(serializer);
			}
		}

		if (!headerInstances.isEmpty()) {
			serializer.beginStruct(headersStructTypeName);
			for (LlvmInstance instance : headerInstances) {
				instance.declareMember(serializer);
			}
			serializer.endStruct();
		}
		if (!metadata.isEmpty()) {
			serializer.beginStruct(metadataStructTypeName);
			for (LlvmInstance instance : metadata) {
				instance.declareMember(serializer);
			}
			serializer.endStruct();
		}

		for (LlvmAction action : actions) {
			action.declareParameters(serializer);
		}
	}

	public void generateTables(ProgramSerializer serializer) {
		for (LlvmTable table : tables) {
			table.serialize(serializer, this);
		}
		for (LlvmCounter counter : counters) {
			counter.serialize(serializer, this);
		}
	}

	private void generateVariables(ProgramSerializer serializer) {
		serializer.declareVariable("uint32_t", offsetVariable, "0");
		serializer.declareVariable("uint8_t", dropBit, "0");
		serializer.declareVariable("enum " + ErrorCode.ENUM_NAME, errorName, ErrorCode.NO_ERROR.getGeneratedName());
		serializer.declareVariable("uint32_t", zeroKeyName, "0");
		serializer.declareVariable("void *", actionDataName, "NULL");
		for (LlvmHeaderStack stack : stacks) {
			serializer.declareVariable("uint32_t", stack.getIndexVariable(), "0");
		}
		for (LlvmTable table : tables) {
			table.declareVariables(serializer);
		}
	}

	public void generateInitializeHeaders(ProgramSerializer serializer) {
		if (headers.isEmpty() && stacks.isEmpty()) {
			return;
		}
		serializer.beginInitializer("struct " + headersStructTypeName, headerStructName);
		for (LlvmHeader header : headers) {
			serializer.initializerField(header.getName(), header.getInitializer());
		}
		for (LlvmHeaderStack stack : stacks) {
			serializer.initializerField(stack.getName(), stack.getInitializer());
		}
		serializer.endInitializer();
	}

	public void generateInitializeMetadata(ProgramSerializer serializer) {
		if (metadata.isEmpty()) {
			return;
		}
		serializer.beginInitializer("struct " + metadataStructTypeName, metadataStructName);
		for (LlvmMetadata instance : metadata) {
			serializer.initializerField(instance.getName(), instance.getInitializer());
		}
		serializer.endInitializer();
	}

	/**
	 * Emits a jump to the start state followed by every parse state. Without
	 * a parser, jumps straight to the pipeline.
	 */
	public void generateParser(ProgramSerializer serializer) {
		P4ParseState start = hlir.getStartState();
		if (start == null) {
			P4ControlFlowNode first = entryPoints.isEmpty() ? egressEntry : entryPoints.get(0);
			serializer.gotoLabel(getLabel(first));
			return;
		}
		serializer.gotoLabel(getLabel(start));
		for (LlvmParser parser : parsers) {
			parser.serialize(serializer, this);
		}
	}

	/**
	 * Linearizes the ingress pipeline, then the egress pipeline. The end of
	 * ingress falls through to the egress entry; the end of egress falls
	 * through to the end of the program.
	 *
	 * @throws NotSupportedException if a node is reachable from both pipelines
	 */
	public void generatePipeline(ProgramSerializer serializer) {
		ingressOrder = generatePipelineInternal(
				serializer,
				entryPoints,
				egressEntry,
				Collections.<P4ControlFlowNode>emptyList());
		if (egressEntry == null) {
			egressOrder = Collections.emptyList();
		} else {
			egressOrder = generatePipelineInternal(
					serializer,
					Collections.singletonList(egressEntry),
					null,
					ingressOrder);
		}
	}

	/**
	 * Emits every node reachable from the seeds, once, in worklist order.
	 *
	 * @param serializer where to emit
	 * @param seeds nodes to start from; {@code null} and duplicates are allowed
	 * @param nextEntryPoint where unconfigured branches go; never emitted by this pass
	 * @param emittedBefore nodes emitted by an earlier pass
	 * @return the emitted nodes, in emission order
	 */
	List<P4ControlFlowNode> generatePipelineInternal(
			ProgramSerializer serializer,
			Collection<P4ControlFlowNode> seeds,
			P4ControlFlowNode nextEntryPoint,
			Collection<P4ControlFlowNode> emittedBefore) {
		Set<P4ControlFlowNode> earlier = Collections.newSetFromMap(new IdentityHashMap<P4ControlFlowNode, Boolean>());
		earlier.addAll(emittedBefore);
		Set<P4ControlFlowNode> visited = Collections.newSetFromMap(new IdentityHashMap<P4ControlFlowNode, Boolean>());
		List<P4ControlFlowNode> emitted = new ArrayList<P4ControlFlowNode>();
		Deque<P4ControlFlowNode> pending = new ArrayDeque<P4ControlFlowNode>();
		for (P4ControlFlowNode seed : seeds) {
			addPending(pending, seed);
		}

		while (!pending.isEmpty()) {
			P4ControlFlowNode node = pending.poll();
			if (node == nextEntryPoint || visited.contains(node)) {
				continue;
			}
			if (earlier.contains(node)) {
				throw new NotSupportedException("control-flow node shared by ingress and egress", node.getName());
			}
			visited.add(node);
			emitted.add(node);
			generateControlFlowNode(serializer, node, nextEntryPoint);
			for (P4ControlFlowNode successor : node.getSuccessors()) {
				addPending(pending, successor);
			}
		}
		return emitted;
	}

	private static void addPending(Deque<P4ControlFlowNode> pending, P4ControlFlowNode node) {
		// ArrayDeque rejects null, and a null successor has nothing to emit
		if (node != null) {
			pending.add(node);
		}
	}

	private void generateControlFlowNode(ProgramSerializer serializer, P4ControlFlowNode node, P4ControlFlowNode nextEntryPoint) {
		LOGGER.debug("Generating {}", node.getName());
		ControlFlowUnit unit = node.accept(unitResolver);
		if (unit.getNode() != node) {
			throw new CompilationException(true, "Control-flow node {0} is not the one declared under that name", node.getName());
		}
		unit.serializeControlFlow(serializer, this, nextEntryPoint);
	}

	private void generateErrorHandlers(ProgramSerializer serializer) {
		for (Map.Entry<ErrorCode, String> handler : errorLabels.entrySet()) {
			serializer.label(handler.getValue());
			serializer.assign(errorName, handler.getKey().getGeneratedName());
			serializer.assign(dropBit, "1");
			serializer.gotoLabel(getLabel(null));
		}
	}

	public void generateDeparser(ProgramSerializer serializer) {
		deparser.serialize(serializer, this);
	}

	/**
	 * @return ingress nodes emitted by the last {@link #generatePipeline}, in order
	 */
	public List<P4ControlFlowNode> getIngressEmissionOrder() {
		return Collections.unmodifiableList(ingressOrder);
	}

	/**
	 * @return egress nodes emitted by the last {@link #generatePipeline}, in order
	 */
	public List<P4ControlFlowNode> getEgressEmissionOrder() {
		return Collections.unmodifiableList(egressOrder);
	}

	public LlvmHeader getHeaderInstance(String instanceName) {
		for (LlvmHeader header : headers) {
			if (header.getName().equals(instanceName)) {
				return header;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.HEADER, instanceName);
	}

	public LlvmHeaderStack getStackInstance(String stackName) {
		for (LlvmHeaderStack stack : stacks) {
			if (stack.getName().equals(stackName)) {
				return stack;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.STACK, stackName);
	}

	public boolean hasStackInstance(String stackName) {
		for (LlvmHeaderStack stack : stacks) {
			if (stack.getName().equals(stackName)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param instanceName a header or metadata name
	 * @return the header or metadata instance
	 */
	public LlvmInstance getInstance(String instanceName) {
		for (LlvmHeader header : headers) {
			if (header.getName().equals(instanceName)) {
				return header;
			}
		}
		for (LlvmMetadata instance : metadata) {
			if (instance.getName().equals(instanceName)) {
				return instance;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.INSTANCE, instanceName);
	}

	public LlvmTable getTable(String tableName) {
		for (LlvmTable table : tables) {
			if (table.getName().equals(tableName)) {
				return table;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.TABLE, tableName);
	}

	public LlvmConditional getConditional(String conditionalName) {
		for (LlvmConditional conditional : conditionals) {
			if (conditional.getName().equals(conditionalName)) {
				return conditional;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.CONDITIONAL, conditionalName);
	}

	public LlvmAction getAction(String actionName) {
		for (LlvmAction action : actions) {
			if (action.getName().equals(actionName)) {
				return action;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.ACTION, actionName);
	}

	public LlvmCounter getCounter(String counterName) {
		for (LlvmCounter counter : counters) {
			if (counter.getName().equals(counterName)) {
				return counter;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.COUNTER, counterName);
	}

	public LlvmParser getParser(String stateName) {
		for (LlvmParser parser : parsers) {
			if (parser.getName().equals(stateName)) {
				return parser;
			}
		}
		throw new EntityNotFoundException(EntityNotFoundException.Kind.PARSE_STATE, stateName);
	}

	public String getName() {
		return name;
	}

	public Hlir getHlir() {
		return hlir;
	}

	public List<LlvmHeader> getHeaders() {
		return Collections.unmodifiableList(headers);
	}

	public List<LlvmMetadata> getMetadata() {
		return Collections.unmodifiableList(metadata);
	}

	public List<LlvmHeaderStack> getStacks() {
		return Collections.unmodifiableList(stacks);
	}

	public List<LlvmParser> getParsers() {
		return Collections.unmodifiableList(parsers);
	}

	public List<LlvmTable> getTables() {
		return Collections.unmodifiableList(tables);
	}

	public List<LlvmConditional> getConditionals() {
		return Collections.unmodifiableList(conditionals);
	}

	public List<LlvmAction> getActions() {
		return Collections.unmodifiableList(actions);
	}

	public List<LlvmCounter> getCounters() {
		return Collections.unmodifiableList(counters);
	}

	/**
	 * @return ingress entry points, in HLIR order, duplicates included
	 */
	public List<P4ControlFlowNode> getEntryPoints() {
		return Collections.unmodifiableList(entryPoints);
	}

	public P4ControlFlowNode getEgressEntry() {
		return egressEntry;
	}

	public LlvmDeparser getDeparser() {
		return deparser;
	}

	LlvmTypeFactory getTypeFactory() {
		return typeFactory;
	}

	public String getPacketName() {
		return packetName;
	}

	public String getPacketSizeName() {
		return packetSizeName;
	}

	public String getDropBitName() {
		return dropBit;
	}

	public String getOffsetVariableName() {
		return offsetVariable;
	}

	public String getZeroKeyName() {
		return zeroKeyName;
	}

	public String getErrorName() {
		return errorName;
	}

	public String getFunctionName() {
		return functionName;
	}

	public String getActionDataName() {
		return actionDataName;
	}

	public String getHeadersStructTypeName() {
		return headersStructTypeName;
	}

	public String getHeaderStructName() {
		return headerStructName;
	}

	public String getMetadataStructTypeName() {
		return metadataStructTypeName;
	}

	public String getMetadataStructName() {
		return metadataStructName;
	}

	/**
	 * @return the expression the generated function returns for packets that are not dropped
	 */
	public String getEgressPortExpression() {
		return egressPortExpression;
	}
}
