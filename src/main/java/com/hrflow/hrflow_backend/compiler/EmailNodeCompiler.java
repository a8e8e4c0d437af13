package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.config.HrflowProperties;
import com.hrflow.hrflow_backend.exception.CompilationException;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.CredentialRef;
import com.hrflow.hrflow_backend.model.config.EmailConfig;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Welcome mail to the employee named in the webhook body. Subject and body are
 * fixed templates; only the recipients come from node config.
 */
@Component
@RequiredArgsConstructor
public class EmailNodeCompiler implements NodeCompiler {

    static final String TYPE = "n8n-nodes-base.emailSend";

    private static final String TRIGGER_EMPLOYEE = "$node[\"" + NodeNames.WEBHOOK_NODE_NAME + "\"].json.body.employee";

    static final String DEFAULT_TO = "={{" + TRIGGER_EMPLOYEE + ".email}}";
    static final String SUBJECT = "=Welcome to HRFlow, {{" + TRIGGER_EMPLOYEE + ".name}}!";
    static final String HTML =
            "=Hi {{" + TRIGGER_EMPLOYEE + ".name}},<br/><br/>"
            + "Welcome to the <b>{{" + TRIGGER_EMPLOYEE + ".department}}</b> department!<br/>"
            + "We're excited to have you join as a <b>{{" + TRIGGER_EMPLOYEE + ".role}}</b>.<br/><br/>"
            + "If you need anything before day one, just reply to this email.<br/><br/>"
            + "Best regards,<br/><b>HRFlow Team</b>";

    // Authors sometimes type the data path instead of an expression; it never resolves in n8n
    private static final String EMPLOYEE_EMAIL_PLACEHOLDER = "json.employee.email";

    private final HrflowProperties properties;

    @Override
    public NodeKind supportedKind() { return NodeKind.EMAIL; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        HrflowProperties.Credentials credentials = properties.getCredentials();
        if (!credentials.hasSmtp()) {
            throw new CompilationException("Missing SMTP credential settings (hrflow.credentials.smtp-id and smtp-name)");
        }
        EmailConfig cfg = (EmailConfig) config;

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("fromEmail", properties.getEmail().getDefaultSender());
        parameters.put("toEmail", resolveRecipient(cfg.to()));
        if (!cfg.cc().isEmpty()) parameters.put("ccEmail", cfg.cc());
        if (!cfg.bcc().isEmpty()) parameters.put("bccEmail", cfg.bcc());
        parameters.put("subject", SUBJECT);
        parameters.put("emailFormat", "html");
        parameters.put("html", HTML);
        parameters.put("options", Map.of());

        return CompiledNode.builder()
                .id(NodeNames.compiledId(node))
                .name(NodeNames.stableName(node))
                .type(TYPE)
                .typeVersion(2.1)
                .position(position)
                .parameters(parameters)
                .credentials(Map.of("smtp", new CredentialRef(
                        credentials.getSmtpId().trim(), credentials.getSmtpName().trim())))
                .build();
    }

    static String resolveRecipient(String to) {
        if (to == null || to.isEmpty() || to.contains(EMPLOYEE_EMAIL_PLACEHOLDER)) {
            return DEFAULT_TO;
        }
        // "{{ ... }}" typed without the leading "=" is still meant as an expression
        return to.startsWith("=") ? to : "=" + to;
    }
}
