package org.theseed.community;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

public class CompartmentTest {

    @Test
    public void testParsing() {
        assertThat(Compartment.of("glc_D[c]"), equalTo(Compartment.CYTOSOL));
        assertThat(Compartment.of("glc_D[e]"), equalTo(Compartment.EXTRACELLULAR));
        assertThat(Compartment.of("glc_D[d]"), equalTo(Compartment.DIET));
        assertThat(Compartment.of("glc_D[u]"), equalTo(Compartment.LUMEN));
        assertThat(Compartment.of("glc_D[fe]"), equalTo(Compartment.FECAL));
        assertThat(Compartment.of("Host_glc_D[b]"), equalTo(Compartment.BODY_FLUID));
        assertThat(Compartment.of("glc_D[m]"), equalTo(Compartment.OTHER));
        assertThat(Compartment.of("glc_D"), equalTo(Compartment.OTHER));
        assertThat(Compartment.baseName("org1_glc_D[e]"), equalTo("org1_glc_D"));
        assertThat(Compartment.baseName("glc_D"), equalTo("glc_D"));
        assertThat(Compartment.FECAL.convert("glc_D[u]"), equalTo("glc_D[fe]"));
        assertThat(Compartment.LUMEN.isConnector(), equalTo(true));
        assertThat(Compartment.BODY_FLUID.isConnector(), equalTo(true));
        assertThat(Compartment.EXTRACELLULAR.isConnector(), equalTo(false));
        assertThat(Compartment.CYTOSOL.isConnector(), equalTo(false));
    }

}
