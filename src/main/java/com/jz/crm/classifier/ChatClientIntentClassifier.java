package com.jz.crm.classifier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.memory.ContextTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ChatClientIntentClassifier implements IntentClassifier {

    static final String FALLBACK_MISSING = "Desculpe, não consegui processar sua mensagem. Um atendente irá ajudá-lo em breve.";
    static final String FALLBACK_UNPARSEABLE = "Desculpe, tive um problema ao processar sua mensagem. Um atendente irá ajudá-lo em breve.";
    static final String FALLBACK_ERROR = "Desculpe, estou com dificuldades técnicas. Um atendente irá ajudá-lo em breve.";

    static final String OUT_OF_HOURS_NOTE =
            "\n\n[ATENÇÃO: Fora do horário comercial. Informe que o atendimento humano está disponível apenas em horário comercial.]";

    private final ChatClient classifierChatClient;
    private final ObjectMapper mapper;

    private static final String SYS_CLASSIFY = """
# PERSONA E OBJETIVO
Você é o assistente virtual de atendimento via WhatsApp.
Responda de forma BREVE, EDUCADA e OBJETIVA.

# REGRAS
1. Se esta for a primeira mensagem da conversa, cumprimente. Se já houver histórico, não repita a saudação.
2. Entenda mensagens picadas como um único contexto.
3. Nunca invente. Se não souber, encaminhe para um humano (needs_human=true).
4. Não peça dados sensíveis (CPF, senhas).
5. Não informe preços no chat; oriente o cliente a baixar o aplicativo.

# INTENÇÕES
- contas_pagar: fornecedores cobrando, envio de notas fiscais.
- compras: novos fornecedores oferecendo produtos, parcerias de fornecimento.
- contas_receber: segunda via de boleto, negociação de dívidas, cobrança.
- comercial: cotação para empresas, vendas em grande quantidade, frotas.
- rh: currículos, vagas de emprego, "trabalhe conosco".
- atendente: pede explicitamente um humano, está irritado, ou diz "Não consegui contato".
- geral: dúvidas comuns (horários, endereços, aplicativo). Tente resolver.
- outros: qualquer outra coisa.

# ENCAMINHAMENTO
- atendente, contas_pagar, compras, contas_receber, comercial, rh -> "needs_human": true
- geral -> "needs_human": false

# FORMATO (JSON obrigatório)
{
  "intent": "contas_pagar|compras|contas_receber|comercial|rh|atendente|geral|outros",
  "needs_human": true|false,
  "response": "texto da resposta",
  "confidence": 0~1
}
Responda apenas o JSON.
""";

    @Override
    public ClassifierVerdict classify(String message, List<ContextTurn> context, String customerName, boolean businessHours) {
        try {
            String out = classifierChatClient.prompt()
                    .system(SYS_CLASSIFY)
                    .messages(toHistory(context))
                    .user(userPrompt(message, customerName, businessHours))
                    .call()
                    .content();
            log.info("[Classifier] raw={}", out);
            return parse(out);
        } catch (Exception e) {
            log.error("[Classifier] call failed: {}", e.getMessage(), e);
            return fallback(FALLBACK_ERROR);
        }
    }

    static String userPrompt(String message, String customerName, boolean businessHours) {
        String p = "Mensagem do cliente: " + message;
        if (StringUtils.hasText(customerName)) {
            p = "Cliente: " + customerName + "\n" + p;
        }
        if (!businessHours) {
            p += OUT_OF_HOURS_NOTE;
        }
        return p;
    }

    static List<Message> toHistory(List<ContextTurn> context) {
        List<Message> out = new ArrayList<>();
        if (context == null) return out;
        for (ContextTurn t : context) {
            if (t == null || t.getContent() == null) continue;
            if (ContextTurn.ASSISTANT.equals(t.getRole())) {
                out.add(new AssistantMessage(t.getContent()));
            } else {
                out.add(new UserMessage(t.getContent()));
            }
        }
        return out;
    }

    /** Lenient: takes the outermost JSON object of the reply and fills defaults for missing fields. */
    ClassifierVerdict parse(String out) {
        if (out == null || out.isBlank()) {
            return fallback(FALLBACK_UNPARSEABLE);
        }
        int b = out.indexOf('{'), e = out.lastIndexOf('}');
        if (b < 0 || e < b) {
            return fallback(FALLBACK_UNPARSEABLE);
        }
        Map<String, Object> m;
        try {
            m = mapper.readValue(out.substring(b, e + 1), new TypeReference<>() {});
        } catch (Exception ex) {
            log.warn("[Classifier] unparseable reply: {}", ex.getMessage());
            return fallback(FALLBACK_UNPARSEABLE);
        }

        Object intent = m.get("intent");
        boolean needsHuman = toBoolean(m.get("needs_human"));
        Object response = m.get("response");
        String text;
        if (response == null) {
            text = FALLBACK_MISSING;
            needsHuman = true;
        } else {
            text = String.valueOf(response);
        }
        return ClassifierVerdict.builder()
                .intent(intent == null ? "outros" : String.valueOf(intent))
                .needsHuman(needsHuman)
                .response(text)
                .confidence(toDouble(m.get("confidence"), .5))
                .build();
    }

    private static ClassifierVerdict fallback(String text) {
        return ClassifierVerdict.builder().intent("outros").needsHuman(true).response(text).confidence(0.0).build();
    }

    private static boolean toBoolean(Object v) {
        if (v instanceof Boolean bool) return bool;
        return v != null && Boolean.parseBoolean(String.valueOf(v));
    }

    private static double toDouble(Object v, double d) {
        try { return v == null ? d : Double.parseDouble(String.valueOf(v)); } catch (Exception e) { return d; }
    }
}
