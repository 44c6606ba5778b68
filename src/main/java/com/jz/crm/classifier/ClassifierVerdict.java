package com.jz.crm.classifier;

import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class ClassifierVerdict {
    private String intent;          // comercial/compras/contas_pagar/contas_receber/rh/atendente/geral/outros
    private boolean needsHuman;
    private String response;        // text sent back to the customer
    private double confidence;      // 0~1
}
