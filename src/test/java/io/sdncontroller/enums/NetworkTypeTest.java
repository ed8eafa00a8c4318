package io.sdncontroller.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkTypeTest {

    @Test
    void testFromStringIsCaseInsensitive() {
        assertThat(NetworkType.fromString("VLAN")).isEqualTo(NetworkType.VLAN);
        assertThat(NetworkType.fromString(" stt ")).isEqualTo(NetworkType.STT);
    }

    @Test
    void testFromStringReturnsNullForUnknownType() {
        assertThat(NetworkType.fromString("vxlan")).isNull();
        assertThat(NetworkType.fromString(null)).isNull();
    }

    @Test
    void testOnlyFlatAndVlanAreBridged() {
        assertThat(NetworkType.FLAT.isBridged()).isTrue();
        assertThat(NetworkType.VLAN.isBridged()).isTrue();
        assertThat(NetworkType.GRE.isBridged()).isFalse();
        assertThat(NetworkType.STT.isBridged()).isFalse();
    }

    @Test
    void testStatusFromFabricStatus() {
        assertThat(ResourceStatus.fromFabricStatus(true)).isEqualTo(ResourceStatus.ACTIVE);
        assertThat(ResourceStatus.fromFabricStatus(false)).isEqualTo(ResourceStatus.DOWN);
    }
}
