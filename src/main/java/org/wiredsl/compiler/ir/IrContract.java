package org.wiredsl.compiler.ir;

/**
 * The versioned output of the IR generator and the input of the layout engine.
 */
public record IrContract(String irVersion, IrProject project) {

	public static final String IR_VERSION = "1.0";

	public IrContract(IrProject project) {
		this(IR_VERSION, project);
	}
}
