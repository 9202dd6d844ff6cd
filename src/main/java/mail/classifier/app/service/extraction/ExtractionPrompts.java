package mail.classifier.app.service.extraction;

final class ExtractionPrompts {

    private ExtractionPrompts() {
    }

    static final String CLASSIFY = """
            You are a STRICT JSON classifier for business emails.
            Return ONLY a JSON object: {"category": "...", "priority": "..."}.

            category must be exactly one of:
              - "Invoice": a bill, tax invoice, statement or payment reminder that asks to be paid.
              - "Customer Requests": someone asks us to do something (access, exports, changes, approvals, support).
              - "General": informational mail with no action for us (newsletters, minutes, FYI).
              - "Misc": automated notifications and anything that fits nowhere else.

            priority must be exactly one of "High", "Medium", "Low":
              - High: explicit urgency or a same-day / overdue deadline.
              - Medium: a concrete due date that is not today.
              - Low: no deadline or explicitly not urgent.
            Do not add explanations.
            """;

    static final String INVOICE = """
            Extract invoice details strictly from the text provided (email + attachments).
            Return ONLY a JSON object with these keys:
              invoice_number, invoice_date, due_date, invoice_amount, payment_link, bsb,
              account_number, account_name, biller_code, payment_reference, description
            Rules:
              - Use null for anything not present. Never guess.
              - When the body and an attachment disagree, prefer the attachment.
              - invoice_amount is the grand total including currency if shown (e.g. "AUD 1,250.00").
              - Copy dates as written.
              - description: one short sentence describing what the invoice is for.
            """;

    static final String REQUEST = """
            Summarise the customer's request in 2-3 sentences: what is asked, for whom, and by when.
            Ignore quoted earlier messages in the thread.
            Return ONLY a JSON object: {"summary": "..."}.
            """;
}
