package io.github.hatchcrm.aiemployees.runtime.persona;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaTemplateRepository;
import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the canonical brokerage personas. Only missing templates are added, so admin edits
 * survive restarts.
 */
@Service
public class PersonaTemplateSeeder {

    private static final Logger log = LoggerFactory.getLogger(PersonaTemplateSeeder.class);

    private static final String JSON_RULES = " Respond only with the JSON format described below.";

    private final PersonaTemplateRepository templateRepository;

    public PersonaTemplateSeeder(PersonaTemplateRepository templateRepository) {
        this.templateRepository = templateRepository;
    }

    @PostConstruct
    public void seed() {
        int added = 0;
        for (PersonaTemplateDocument template : defaults()) {
            if (templateRepository.existsById(template.getKey())) continue;
            templateRepository.save(template);
            added++;
        }
        if (added > 0) {
            log.info("Seeded {} persona templates", added);
        } else {
            log.info("Persona templates already seeded");
        }
    }

    List<PersonaTemplateDocument> defaults() {
        return List.of(
                template("hatch_assistant", "Hatch",
                        "Front-desk assistant that answers brokerage questions and routes work to the team.",
                        "You are Hatch, the brokerage's front-desk AI assistant. Answer briefly and hand specialised work to the right teammate.",
                        List.of("get_daily_summary", "get_hot_leads", "get_overdue_tasks",
                                "delegate_to_employee", "coordinate_workflow"), "#F59E0B"),
                template("agent_copilot", "Echo",
                        "Daily briefings, call priorities and next steps for agents.",
                        "You are Echo, an agent copilot. Keep agents focused on the leads and tasks that matter today.",
                        List.of("get_daily_summary", "get_hot_leads", "get_idle_leads", "get_overdue_tasks",
                                "lead_add_note", "lead_create_follow_up_task",
                                "delegate_to_employee", "coordinate_workflow"), "#6366F1"),
                template("lead_nurse", "Lumen",
                        "Writes and sends follow-ups that keep leads warm.",
                        "You are Lumen, a lead nurture specialist. Write short, personal follow-ups and keep leads engaged.",
                        List.of("get_idle_leads", "draft_idle_lead_followups", "lead_add_note",
                                "lead_create_follow_up_task", "send_email", "send_sms"), "#10B981"),
                template("listing_concierge", "Haven",
                        "Listing preparation, marketing and seller communication.",
                        "You are Haven, a listing concierge. Help agents present listings well and keep sellers informed.",
                        List.of("get_daily_summary", "lead_add_note", "send_email"), "#EC4899"),
                template("market_analyst", "Atlas",
                        "Market trends and pipeline analysis.",
                        "You are Atlas, a market analyst. Explain market and pipeline numbers plainly.",
                        List.of("get_daily_summary", "get_hot_leads"), "#0EA5E9"),
                template("transaction_coordinator", "Nova",
                        "Deadlines, paperwork and task follow-through for deals in progress.",
                        "You are Nova, a transaction coordinator. Track deadlines and make sure nothing slips.",
                        List.of("get_overdue_tasks", "lead_create_follow_up_task", "send_email"), "#8B5CF6"));
    }

    private static PersonaTemplateDocument template(String key, String name, String description, String prompt,
                                                    List<String> tools, String color) {
        Instant now = Instant.now();
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("personaColor", color);
        settings.put("tone", "professional");

        PersonaTemplateDocument doc = new PersonaTemplateDocument();
        doc.setKey(key);
        doc.setDisplayName(name);
        doc.setDescription(description);
        doc.setSystemPrompt(prompt + JSON_RULES);
        doc.setAllowedTools(tools);
        doc.setDefaultAutonomyMode(AutonomyMode.REQUIRES_APPROVAL);
        doc.setDefaultSettings(settings);
        doc.setActive(true);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }
}
