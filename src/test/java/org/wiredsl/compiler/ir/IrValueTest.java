package org.wiredsl.compiler.ir;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class IrValueTest {

	@Test
	void asText() {
		assertThat(IrValue.of("hello").asText()).isEqualTo("hello");
		assertThat(IrValue.of(12).asText()).isEqualTo("12");
		assertThat(IrValue.of(1.5).asText()).isEqualTo("1.5");
		assertThat(new IrValue.Unbound("title").asText()).isEqualTo("prop_title");
	}

	@Test
	void asNumber() {
		assertThat(IrValue.of(3).asNumber()).hasValue(3.0);
		assertThat(IrValue.of(" 240 ").asNumber()).hasValue(240.0);
		assertThat(IrValue.of("wide").asNumber()).isEmpty();
		assertThat(IrValue.of("NaN").asNumber()).isEmpty();
		assertThat(new IrValue.Unbound("width").asNumber()).isEmpty();
	}

	@Test
	void containerTypeFromName() {
		assertThat(ContainerType.fromName("grid")).contains(ContainerType.GRID);
		assertThat(ContainerType.fromName("Grid")).isEmpty();
		assertThat(ContainerType.CARD.token()).isEqualTo("card");
	}
}
