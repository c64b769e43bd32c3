package org.wiredsl.compiler.frontend.irgen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wiredsl.compiler.api.CompilationException;
import org.wiredsl.compiler.api.CompilerErrorCode;
import org.wiredsl.compiler.diagnostics.Diagnostic;
import org.wiredsl.compiler.diagnostics.DiagnosticsEngine;
import org.wiredsl.compiler.frontend.ast.ProjectNode;
import org.wiredsl.compiler.frontend.ast.PropertyValue;
import org.wiredsl.compiler.frontend.ast.ScreenNode;
import org.wiredsl.compiler.frontend.semantics.DefinitionTable;
import org.wiredsl.compiler.ir.IrContract;
import org.wiredsl.compiler.ir.IrContractValidator;
import org.wiredsl.compiler.ir.IrProject;
import org.wiredsl.compiler.ir.IrScreen;
import org.wiredsl.compiler.ir.IrStyle;
import org.wiredsl.compiler.ir.IrValue;
import org.wiredsl.compiler.ir.NodeRef;
import org.wiredsl.compiler.ir.Viewport;
import org.wiredsl.compiler.style.DensityLevel;
import org.wiredsl.compiler.style.DevicePreset;
import org.wiredsl.compiler.style.DevicePresets;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Phase: composes the IR contract from a parsed project.
 * <p>
 * Definitions are registered first, then every screen root is lowered through the converters of the
 * {@link IrConverterRegistry}. Errors are collected across the whole project and thrown once.
 * An instance is not thread-safe; its state is reset at the start of every {@link #generate} call.
 */
public final class IrGenerator {

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;
	private final String defaultDevice;
	private final IdGenerator ids = new IdGenerator();
	private List<Diagnostic> warnings = List.of();

	/**
	 * Creates a generator with its own diagnostics, the default converters and the desktop viewport.
	 */
	public IrGenerator() {
		this(new DiagnosticsEngine(), IrConverterRegistry.initializeWithDefaults(), DevicePresets.DEFAULT_DEVICE);
	}

	/**
	 * Creates a new IR generator.
	 *
	 * @param diagnostics   The diagnostics engine for reporting issues.
	 * @param registry      The converter registry.
	 * @param defaultDevice The device preset used when the project style names none.
	 */
	public IrGenerator(DiagnosticsEngine diagnostics, IrConverterRegistry registry, String defaultDevice) {
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.defaultDevice = defaultDevice;
	}

	/**
	 * Generates the IR contract of a project.
	 *
	 * @param project The parsed project.
	 * @return The validated IR contract.
	 * @throws CompilationException if undefined components are used or any semantic error was found.
	 */
	public IrContract generate(ProjectNode project) throws CompilationException {
		long start = System.nanoTime();
		ids.reset();
		diagnostics.clear();

		DefinitionTable definitions = new DefinitionTable(diagnostics);
		definitions.registerAll(project);
		IrStyle style = resolveStyle(project.style());
		IrGenContext ctx = new IrGenContext(diagnostics, definitions, ids, registry);

		DevicePreset preset = DevicePresets.resolve(style.device() != null ? style.device() : defaultDevice);
		Viewport viewport = new Viewport(preset.width(), preset.minHeight());

		List<IrScreen> screens = new ArrayList<>();
		for (ScreenNode screen : project.screens()) {
			Optional<String> root = ctx.convert(screen.layout(), ExpansionContext.root());
			if (root.isEmpty()) continue;
			screens.add(new IrScreen(sanitizeId(screen.name()), screen.name(), viewport,
					screenBackground(screen, style), new NodeRef(root.get())));
		}

		warnings = diagnostics.warnings();
		warnings.forEach(w -> LOG.warn("{}", w));

		Set<String> undefined = ctx.undefinedComponents();
		if (!undefined.isEmpty()) {
			String message = "Components used but not defined: " + String.join(", ", undefined)
					+ "\nDefine these components with: define Component \"Name\" { ... }";
			diagnostics.reportError(CompilerErrorCode.UNDEFINED_COMPONENTS_USED, message);
			throw new CompilationException(CompilerErrorCode.UNDEFINED_COMPONENTS_USED, message, diagnostics.getDiagnostics());
		}
		if (diagnostics.hasErrors()) {
			String message = "IR generation failed with semantic errors:\n" + diagnostics.errors().stream()
					.map(e -> "- [" + e.code().key() + "] " + e.message())
					.collect(Collectors.joining("\n"));
			throw new CompilationException(CompilerErrorCode.COMPOSITION_FAILED, message, diagnostics.getDiagnostics());
		}

		IrProject irProject = new IrProject(sanitizeId(project.name()), project.name(), style,
				project.mocks(), project.colors(), screens, ctx.nodes());
		IrContract contract = new IrContract(irProject);
		IrContractValidator.validate(contract);

		if (LOG.isDebugEnabled()) {
			LOG.debug("Generated IR for '{}': {} screens, {} nodes in {} ms", project.name(), screens.size(),
					irProject.nodes().size(), (System.nanoTime() - start) / 1_000_000);
		}
		return contract;
	}

	/**
	 * @return The warnings of the last {@link #generate} call, in reporting order.
	 */
	public List<Diagnostic> getWarnings() {
		return warnings;
	}

	private IrStyle resolveStyle(Map<String, String> raw) {
		IrStyle defaults = IrStyle.defaults();
		DensityLevel density = defaults.density();
		String densityToken = raw.get("density");
		if (densityToken != null && !densityToken.isEmpty()) {
			Optional<DensityLevel> level = DensityLevel.fromToken(densityToken);
			if (level.isPresent()) {
				density = level.get();
			} else {
				invalidStyle("density", densityToken, defaults.density().token());
			}
		}
		String device = raw.get("device");
		if (device != null && !device.isEmpty() && !DevicePresets.isValidDevice(device)) {
			diagnostics.reportWarning(CompilerErrorCode.INVALID_STYLE_VALUE,
					String.format("Unknown device \"%s\"; falling back to \"%s\".", device, DevicePresets.DEFAULT_DEVICE));
		}
		return new IrStyle(
				density,
				enumStyle(raw, "spacing", IrStyle.SPACING_VALUES, defaults.spacing()),
				enumStyle(raw, "radius", IrStyle.RADIUS_VALUES, defaults.radius()),
				enumStyle(raw, "stroke", IrStyle.STROKE_VALUES, defaults.stroke()),
				enumStyle(raw, "font", IrStyle.FONT_VALUES, defaults.font()),
				blankToNull(raw.get("background")),
				blankToNull(raw.get("theme")),
				blankToNull(device));
	}

	private String enumStyle(Map<String, String> raw, String key, Set<String> allowed, String fallback) {
		String value = raw.get(key);
		if (value == null || value.isEmpty()) return fallback;
		if (allowed.contains(value)) return value;
		invalidStyle(key, value, fallback);
		return fallback;
	}

	private void invalidStyle(String key, String value, String fallback) {
		diagnostics.reportWarning(CompilerErrorCode.INVALID_STYLE_VALUE,
				String.format("Invalid style %s \"%s\"; using \"%s\".", key, value, fallback));
	}

	private static String screenBackground(ScreenNode screen, IrStyle style) {
		PropertyValue background = screen.params().get("background");
		if (background instanceof PropertyValue.Str s && !s.value().isEmpty()) return s.value();
		if (background instanceof PropertyValue.Num n) return IrValue.formatNumber(n.value());
		return style.background();
	}

	private static String blankToNull(String value) {
		return value == null || value.isEmpty() ? null : value;
	}

	/**
	 * Derives an id from a display name: lower case, whitespace runs become {@code _},
	 * anything outside {@code [a-z0-9_]} is dropped.
	 *
	 * @param name The display name.
	 * @return The sanitized id.
	 */
	static String sanitizeId(String name) {
		return name.toLowerCase(Locale.ROOT)
				.replaceAll("\\s+", "_")
				.replaceAll("[^a-z0-9_]", "");
	}
}
