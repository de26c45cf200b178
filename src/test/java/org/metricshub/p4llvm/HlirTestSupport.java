package org.metricshub.p4llvm;

import java.util.ArrayList;
import java.util.List;
import org.metricshub.p4llvm.backend.LlvmProgram;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.hlir.P4Action;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;
import org.metricshub.p4llvm.hlir.P4HeaderType;
import org.metricshub.p4llvm.hlir.P4MatchKey;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.intermediate.Directive;
import org.metricshub.p4llvm.intermediate.DirectiveKind;
import org.metricshub.p4llvm.intermediate.DirectiveList;
import org.metricshub.p4llvm.intermediate.ProgramPrinter;

/**
 * Reusable helpers for building small HLIR programs and inspecting what the
 * backend generates for them.
 * <p>
 * {@link #program()} starts from a parser extracting an Ethernet header, with
 * a standard metadata instance carrying the egress port; tests add the
 * tables, conditionals and states they exercise.
 */
public final class HlirTestSupport {

	public static final P4HeaderType ETHERNET_T = P4HeaderType
			.builder("ethernet_t")
			.field("dstAddr", 48)
			.field("srcAddr", 48)
			.field("etherType", 16)
			.build();

	public static final P4HeaderType IPV4_T = P4HeaderType
			.builder("ipv4_t")
			.field("ttl", 8)
			.field("protocol", 8)
			.field("srcAddr", 32)
			.field("dstAddr", 32)
			.build();

	public static final P4HeaderType VLAN_T = P4HeaderType
			.builder("vlan_t")
			.field("pcp", 3)
			.field("cfi", 1)
			.field("vid", 12)
			.field("etherType", 16)
			.build();

	public static final P4HeaderType STANDARD_METADATA_T = P4HeaderType
			.builder("standard_metadata_t")
			.field("ingress_port", 9)
			.field("egress_port", 9)
			.build();

	private HlirTestSupport() {}

	/**
	 * @return a builder holding the Ethernet and metadata declarations, without parse states
	 */
	public static Hlir.Builder declarations() {
		return Hlir
				.builder()
				.headerType(ETHERNET_T)
				.headerType(STANDARD_METADATA_T)
				.headerInstance(P4HeaderInstance.header("ethernet", ETHERNET_T))
				.headerInstance(P4HeaderInstance.metadata("standard_metadata", STANDARD_METADATA_T));
	}

	/**
	 * Creates a program whose single parse state extracts Ethernet and enters
	 * the pipeline at {@code ingressEntry}.
	 *
	 * @param ingressEntry first node of the ingress pipeline, or {@code null}
	 * @return the builder, ready for tables and conditionals
	 */
	public static Hlir.Builder program(P4ControlFlowNode ingressEntry) {
		P4ParseState start = new P4ParseState("start").extract("ethernet").then(ingressEntry);
		return declarations().parseState(start);
	}

	/**
	 * @param name action name
	 * @return an action doing nothing
	 */
	public static P4Action noOp(String name) {
		return P4Action.builder(name).call("no_op").build();
	}

	/**
	 * @param name table name
	 * @param actions names of the actions of the table
	 * @return a table matching the Ethernet type exactly
	 */
	public static P4Table exactTable(String name, String... actions) {
		P4Table table = new P4Table(name).matchOn(P4Expression.field("ethernet", "etherType"), P4MatchKey.MatchType.EXACT);
		for (String action : actions) {
			table.action(action);
		}
		return table;
	}

	/**
	 * Lowers a program the way {@link P4Llvm#compile(Hlir)} does.
	 *
	 * @param hlir the program
	 * @return the lowered program and its output
	 */
	public static Compiled compile(Hlir hlir) {
		P4Llvm compiler = new P4Llvm();
		DirectiveList directives = compiler.compile(hlir);
		return new Compiled(compiler.getLastProgram(), directives);
	}

	/**
	 * A lowered program and the directives generated for it.
	 */
	public static final class Compiled {
		private final LlvmProgram program;
		private final DirectiveList directives;

		Compiled(LlvmProgram program, DirectiveList directives) {
			this.program = program;
			this.directives = directives;
		}

		public LlvmProgram program() {
			return program;
		}

		public DirectiveList directives() {
			return directives;
		}

		public String text() {
			return new ProgramPrinter().print(directives);
		}

		/**
		 * @param label a label
		 * @return how many times the label is defined
		 */
		public int definitions(String label) {
			int count = 0;
			for (Directive directive : directives.directivesOfKind(DirectiveKind.LABEL)) {
				if (directive.stringArg(0).equals(label)) {
					count++;
				}
			}
			return count;
		}

		/**
		 * @return every label some directive jumps to, with repetitions
		 */
		public List<String> jumpTargets() {
			List<String> targets = new ArrayList<String>();
			for (Directive directive : directives.getDirectives()) {
				targets.addAll(directive.targetLabels());
			}
			return targets;
		}

		/**
		 * @param kind a directive kind
		 * @param text text searched in the string operands
		 * @return whether a directive of that kind has an operand containing the text
		 */
		public boolean has(DirectiveKind kind, String text) {
			for (Directive directive : directives.directivesOfKind(kind)) {
				for (Object operand : directive.getOperands()) {
					if (operand instanceof String && ((String) operand).contains(text)) {
						return true;
					}
				}
			}
			return false;
		}
	}
}
