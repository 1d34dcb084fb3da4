/**
 *
 */
package org.theseed.community;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

public class HostAdapterTest {

    @Test
    public void testAdapt() {
        MetaModel raw = ModelFixtures.host();
        MetaModel host = HostAdapter.adapt(raw);
        // Every metabolite is either namespaced or in a connector compartment.
        for (String metId : host.getMetabolites()) {
            Compartment comp = Compartment.of(metId);
            assertThat(metId, metId.startsWith("Host_") || comp == Compartment.LUMEN, equalTo(true));
        }
        assertThat(host.getMetabolites(Compartment.LUMEN), containsInAnyOrder("glc_D[u]", "gchola[u]"));
        assertThat(host.getMetabolites(Compartment.BODY_FLUID), containsInAnyOrder("Host_h2o[b]", "Host_glc_D[b]",
                "Host_gchola[b]"));
        // Water is only exchanged, so it never reaches the lumen.
        assertThat(host.hasMetabolite("Host_h2o[e]"), equalTo(false));
        // The original exchanges are gone, replaced by the blood exchanges.
        assertThat(host.hasReaction("Host_EX_h2o[e]"), equalTo(false));
        Reaction blood = host.requireReaction("Host_EX_h2o[e]b");
        assertThat(blood.getRole(), equalTo(ReactionRole.HOST_BLOOD_EXCHANGE));
        assertThat(blood.getStoichiometry().keySet(), contains("Host_h2o[b]"));
        Reaction bloodTransport = host.requireReaction("Host_GLCtb");
        assertThat(bloodTransport.getCoefficient("Host_glc_D[b]"), equalTo(-1.0));
        assertThat(bloodTransport.getCoefficient("Host_glc_D[c]"), equalTo(1.0));
        // The lumen transporters connect the host extracellular space to the lumen.
        Reaction lumen = host.requireReaction("Host_IEX_gchola[u]tr");
        assertThat(lumen.getRole(), equalTo(ReactionRole.HOST_LUMEN_EXCHANGE));
        assertThat(lumen.getCoefficient("Host_gchola[e]"), equalTo(-1.0));
        assertThat(lumen.getCoefficient("gchola[u]"), equalTo(1.0));
        assertThat(host.requireReaction("Host_GCHOLAt").getCoefficient("Host_gchola[e]"), equalTo(1.0));
        assertThat(host.requireReaction("Host_biomass_maintenance").getRole(), equalTo(ReactionRole.BIOMASS));
        assertThat(host.getReactions(ReactionRole.EXCHANGE), empty());
        // The input is unchanged.
        assertThat(raw.hasReaction("EX_h2o[e]"), equalTo(true));
        host.validate();
    }

    @Test
    public void testExchangeMetabolites() {
        MetaModel raw = ModelFixtures.host();
        raw.addMetabolite("biomass[e]");
        raw.addReaction(new Reaction("EX_biomass[e]").setCoefficient("biomass[e]", -1.0));
        // Water is included even though the adapter prunes it.
        assertThat(HostAdapter.exchangeMetabolites(raw), contains("h2o[e]", "glc_D[e]", "gchola[e]"));
        assertThat(HostAdapter.exchangeMetabolites(new MetaModel("empty")), empty());
    }

}
