package com.teamA.cra.common.notification.template;

import com.teamA.cra.common.domain.enums.NotificationLanguage;

import java.util.EnumMap;
import java.util.Map;

/**
 * 메일 본문 고정 문구 + 상태 라벨 (언어별)
 */
public record EmailStrings(
        String notificationLabel,
        String requestCreatedLabel,
        String statusUpdatedLabel,
        String metaRequestPrefix,
        String metaByPrefix,
        String linkFallbackPrefix,
        String footerFallback,
        String clientLabel,
        String countryLabel,
        String applicationVehicleLabel,
        String expectedQtyLabel,
        String expectedDeliveryDateLabel,
        String commentLabel,
        Map<String, String> statusLabels
) {

    private static final Map<NotificationLanguage, EmailStrings> BY_LANG = new EnumMap<>(NotificationLanguage.class);

    static {
        BY_LANG.put(NotificationLanguage.EN, new EmailStrings(
                "CRA Notification",
                "New Request",
                "Status Updated",
                "Request",
                "By",
                "If the button doesn't work, use this link:",
                "You received this email because you are subscribed to CRA request notifications.",
                "Client",
                "Country",
                "Application Vehicle",
                "Expected Qty",
                "Expected Delivery Date",
                "Comment",
                Map.ofEntries(
                        Map.entry("draft", "Draft"),
                        Map.entry("submitted", "Submitted"),
                        Map.entry("edited", "Edited"),
                        Map.entry("design_result", "Design Result"),
                        Map.entry("under_review", "Under Review"),
                        Map.entry("clarification_needed", "Clarification Needed"),
                        Map.entry("feasibility_confirmed", "Feasibility Confirmed"),
                        Map.entry("in_costing", "In Costing"),
                        Map.entry("costing_complete", "Costing Complete"),
                        Map.entry("sales_followup", "Sales Follow-up"),
                        Map.entry("gm_approval_pending", "GM Approval Pending"),
                        Map.entry("gm_approved", "Approved"),
                        Map.entry("gm_rejected", "Rejected by GM"),
                        Map.entry("closed", "Closed")
                )
        ));

        BY_LANG.put(NotificationLanguage.FR, new EmailStrings(
                "Notification CRA",
                "Nouvelle demande",
                "Statut mis a jour",
                "Demande",
                "Par",
                "Si le bouton ne fonctionne pas, utilisez ce lien :",
                "Vous recevez cet e-mail car vous etes abonne aux notifications des demandes CRA.",
                "Client",
                "Pays",
                "Vehicule d'application",
                "Quantite prevue",
                "Date de livraison prevue",
                "Commentaire",
                Map.ofEntries(
                        Map.entry("draft", "Brouillon"),
                        Map.entry("submitted", "Soumis"),
                        Map.entry("edited", "Modifie"),
                        Map.entry("design_result", "Resultat design"),
                        Map.entry("under_review", "En cours de revue"),
                        Map.entry("clarification_needed", "Clarification requise"),
                        Map.entry("feasibility_confirmed", "Faisabilite confirmee"),
                        Map.entry("in_costing", "En chiffrage"),
                        Map.entry("costing_complete", "Chiffrage termine"),
                        Map.entry("sales_followup", "Suivi commercial"),
                        Map.entry("gm_approval_pending", "Approbation DG en attente"),
                        Map.entry("gm_approved", "Approuve"),
                        Map.entry("gm_rejected", "Rejete par DG"),
                        Map.entry("closed", "Cloture")
                )
        ));

        BY_LANG.put(NotificationLanguage.ZH, new EmailStrings(
                "CRA 通知",
                "新请求",
                "状态更新",
                "请求",
                "操作人",
                "如果按钮无法打开，请使用此链接：",
                "您收到此邮件是因为您订阅了 CRA 请求通知。",
                "客户",
                "国家",
                "应用车辆",
                "预计数量",
                "预计交付日期",
                "备注",
                Map.ofEntries(
                        Map.entry("draft", "草稿"),
                        Map.entry("submitted", "已提交"),
                        Map.entry("edited", "已编辑"),
                        Map.entry("design_result", "设计结果"),
                        Map.entry("under_review", "审核中"),
                        Map.entry("clarification_needed", "需要澄清"),
                        Map.entry("feasibility_confirmed", "可行性已确认"),
                        Map.entry("in_costing", "成本核算中"),
                        Map.entry("costing_complete", "成本核算完成"),
                        Map.entry("sales_followup", "销售跟进"),
                        Map.entry("gm_approval_pending", "总经理审批中"),
                        Map.entry("gm_approved", "已批准"),
                        Map.entry("gm_rejected", "总经理已拒绝"),
                        Map.entry("closed", "已关闭")
                )
        ));
    }

    public static EmailStrings forLanguage(NotificationLanguage lang) {
        return BY_LANG.getOrDefault(lang, BY_LANG.get(NotificationLanguage.BASE));
    }

    /** 라벨이 없으면 humanize (cancelled -> "Cancelled") */
    public String statusLabel(String statusCode) {
        String code = statusCode == null ? "" : statusCode.trim();
        if (code.isEmpty()) return "";
        String label = statusLabels.get(code);
        return label != null ? label : humanize(code);
    }

    /** "gm_approval_pending" -> "Gm Approval Pending" */
    public static String humanize(String code) {
        String spaced = code == null ? "" : code.trim().replace('_', ' ').replaceAll("\\s+", " ");
        StringBuilder out = new StringBuilder(spaced.length());
        boolean wordStart = true;
        for (char c : spaced.toCharArray()) {
            out.append(wordStart ? Character.toUpperCase(c) : c);
            wordStart = !Character.isLetterOrDigit(c);
        }
        return out.toString();
    }
}
