package org.wiredsl.compiler.ir;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class IrContractValidatorTest {

	private static IrContainerNode stack(String id, String... children) {
		return new IrContainerNode(id, ContainerType.STACK, Map.of(),
				Arrays.stream(children).map(NodeRef::new).toList(),
				new IrNodeStyle("none", null, null, null, null), new IrMeta(null, null));
	}

	private static IrComponentNode button(String id) {
		return new IrComponentNode(id, "Button", Map.of("text", new IrValue.Str("Go")), IrNodeStyle.empty(), new IrMeta(null, null));
	}

	private static IrContract contract(IrStyle style, String root, IrNode... nodes) {
		Map<String, IrNode> map = new LinkedHashMap<>();
		for (IrNode node : nodes) map.put(node.id(), node);
		IrScreen screen = new IrScreen("main", "Main", new Viewport(1280, 720), null, new NodeRef(root));
		return new IrContract(new IrProject("p", "P", style, Map.of(), Map.of(), List.of(screen), map));
	}

	@Test
	void validate_acceptsWellFormedContract() {
		IrContract contract = contract(IrStyle.defaults(), "node_1", stack("node_1", "node_2"), button("node_2"));

		assertThatCode(() -> IrContractValidator.validate(contract)).doesNotThrowAnyException();
	}

	@Test
	void validate_rejectsDanglingChild() {
		IrContract contract = contract(IrStyle.defaults(), "node_1", stack("node_1", "node_9"));

		assertThatThrownBy(() -> IrContractValidator.validate(contract))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("references unknown node 'node_9'");
	}

	@Test
	void validate_rejectsUnknownRoot() {
		IrContract contract = contract(IrStyle.defaults(), "node_5", stack("node_1"));

		assertThatThrownBy(() -> IrContractValidator.validate(contract))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("unknown root 'node_5'");
	}

	@Test
	void validate_rejectsUnreachableNode() {
		IrContract contract = contract(IrStyle.defaults(), "node_1", stack("node_1"), button("node_2"));

		assertThatThrownBy(() -> IrContractValidator.validate(contract))
				.hasMessageContaining("Node 'node_2' is not reachable");
	}

	@Test
	void validate_rejectsOutOfRangeStyle() {
		IrStyle style = new IrStyle(IrStyle.defaults().density(), "huge", "md", "normal", "base", null, null, null);
		IrContract contract = contract(style, "node_1", stack("node_1"));

		assertThatThrownBy(() -> IrContractValidator.validate(contract))
				.hasMessageContaining("Style spacing has out-of-range value 'huge'");
	}

	@Test
	void validate_rejectsMismatchedKey() {
		Map<String, IrNode> nodes = new LinkedHashMap<>();
		nodes.put("node_1", stack("node_1", "node_2"));
		nodes.put("node_2", button("node_3"));
		IrScreen screen = new IrScreen("main", "Main", new Viewport(1280, 720), null, new NodeRef("node_1"));
		IrContract contract = new IrContract(new IrProject("p", "P", IrStyle.defaults(), Map.of(), Map.of(), List.of(screen), nodes));

		assertThatThrownBy(() -> IrContractValidator.validate(contract))
				.hasMessageContaining("stored under 'node_2' has id 'node_3'");
	}

	@Test
	void validate_rejectsWrongVersion() {
		IrContract valid = contract(IrStyle.defaults(), "node_1", stack("node_1"));
		IrContract contract = new IrContract("2.0", valid.project());

		assertThatThrownBy(() -> IrContractValidator.validate(contract))
				.hasMessageContaining("Unsupported IR version 2.0");
	}
}
