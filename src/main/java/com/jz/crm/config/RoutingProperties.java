package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The single sector catalogue. Queue-size reporting, intent routing and the
 * REST boundary all read from here.
 */
@Data
@ConfigurationProperties(prefix = "crm.routing")
public class RoutingProperties {

    private String queueKeyPrefix = "queue:";

    private List<String> sectors = new ArrayList<>(List.of(
            "comercial",
            "compras",
            "contas_pagar",
            "contas_receber",
            "rh",
            "atendimento_humano",
            "geral",
            "outros"
    ));

    /** intent -> sector; every sector maps to itself, "atendente" escalates. */
    private Map<String, String> intentSectors = new LinkedHashMap<>(Map.of(
            "comercial", "comercial",
            "compras", "compras",
            "contas_pagar", "contas_pagar",
            "contas_receber", "contas_receber",
            "rh", "rh",
            "atendente", "atendimento_humano",
            "geral", "geral",
            "outros", "outros"
    ));

    /** Queue used when the classifier asks for a human but no sector resolved. */
    private String defaultHandoffSector = "atendimento_humano";

    /** Label used for notifications while a conversation has no sector. */
    private String notifyFallbackSector = "comercial";

    /** A resolved conversation reopens if the customer writes again within this window. */
    private Duration reactivationWindow = Duration.ofHours(24);

    public boolean isSector(String name) {
        return name != null && sectors.contains(name.toLowerCase(Locale.ROOT));
    }
}
