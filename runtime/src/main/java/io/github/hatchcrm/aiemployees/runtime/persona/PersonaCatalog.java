package io.github.hatchcrm.aiemployees.runtime.persona;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaInstanceDocument;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaInstanceRepository;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaTemplateRepository;
import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaInstanceDto;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaStatus;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaTemplateDto;
import io.github.hatchcrm.aiemployees.protocol.api.UpdateTemplateRequest;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.error.ForbiddenException;
import io.github.hatchcrm.aiemployees.runtime.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Persona templates and their per-tenant instances. Read-mostly; the only writes are
 * tenant provisioning and admin edits.
 */
@Service
public class PersonaCatalog {

    private static final Logger log = LoggerFactory.getLogger(PersonaCatalog.class);

    public static final Set<String> ADMIN_ROLES = Set.of("BROKER", "TEAM_LEAD");

    private final PersonaTemplateRepository templateRepository;
    private final PersonaInstanceRepository instanceRepository;

    public PersonaCatalog(PersonaTemplateRepository templateRepository, PersonaInstanceRepository instanceRepository) {
        this.templateRepository = templateRepository;
        this.instanceRepository = instanceRepository;
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    public List<PersonaTemplateDto> listTemplates() {
        return templateRepository.findAll().stream()
                .sorted(Comparator.comparing(PersonaTemplateDocument::getKey))
                .map(PersonaCatalog::toTemplateDto)
                .toList();
    }

    public List<PersonaTemplateDocument> activeTemplates() {
        return templateRepository.findByActiveTrue();
    }

    public Optional<PersonaTemplateDocument> findTemplate(String key) {
        return key == null ? Optional.empty() : templateRepository.findById(key);
    }

    /**
     * Matches a free-form persona reference ("Lumen", "lead-nurse", " Lead Nurse ") against the
     * active templates, first by key, then by display name.
     */
    public Optional<PersonaTemplateDocument> resolvePersona(String reference) {
        String normalized = normalize(reference);
        if (normalized.isEmpty()) return Optional.empty();
        List<PersonaTemplateDocument> templates = activeTemplates();
        for (PersonaTemplateDocument t : templates) {
            if (normalized.equals(t.getKey())) return Optional.of(t);
        }
        for (PersonaTemplateDocument t : templates) {
            if (normalized.equals(normalize(t.getDisplayName()))) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static String normalize(String raw) {
        if (raw == null) return "";
        return raw.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s-]+", "_")
                .replaceAll("[^a-z0-9_]", "");
    }

    public PersonaTemplateDto updateTemplate(String key, UpdateTemplateRequest request, String role) {
        requireAdmin(role);
        PersonaTemplateDocument template = templateRepository.findById(key)
                .orElseThrow(() -> new NotFoundException("Template not found"));
        if (request == null) {
            return toTemplateDto(template);
        }

        if (request.displayName() != null) template.setDisplayName(request.displayName().trim());
        if (request.description() != null) template.setDescription(request.description().trim());
        if (request.systemPrompt() != null) template.setSystemPrompt(request.systemPrompt().trim());
        if (request.allowedTools() != null) {
            template.setAllowedTools(request.allowedTools().stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(tool -> !tool.isEmpty())
                    .distinct()
                    .collect(Collectors.toList()));
        }
        if (request.defaultSettings() != null) {
            Map<String, Object> merged = new LinkedHashMap<>();
            if (template.getDefaultSettings() != null) merged.putAll(template.getDefaultSettings());
            merged.putAll(request.defaultSettings());
            template.setDefaultSettings(merged);
        }
        template.setUpdatedAt(Instant.now());
        PersonaTemplateDocument saved = templateRepository.save(template);
        log.info("Template {} updated", key);
        return toTemplateDto(saved);
    }

    // ------------------------------------------------------------------
    // Instances
    // ------------------------------------------------------------------

    public Optional<PersonaInstanceDocument> findActiveInstance(String tenantId, String personaKey) {
        return instanceRepository.findFirstByTenantIdAndTemplateKeyAndStatus(tenantId, personaKey, PersonaStatus.ACTIVE);
    }

    public PersonaInstanceDocument requireInstance(String tenantId, String instanceId) {
        return instanceRepository.findByIdAndTenantId(instanceId, tenantId)
                .orElseThrow(() -> new NotFoundException("AI employee not found"));
    }

    /**
     * Creates the missing instance for every active template. Existing instances are left as they are.
     * New instances always start in requires-approval; only an admin can widen that.
     */
    public void ensureInstancesForTenant(String tenantId) {
        Set<String> existing = instanceRepository.findByTenantId(tenantId).stream()
                .map(PersonaInstanceDocument::getTemplateKey)
                .collect(Collectors.toSet());
        for (PersonaTemplateDocument template : activeTemplates()) {
            if (existing.contains(template.getKey())) continue;
            Instant now = Instant.now();
            PersonaInstanceDocument instance = new PersonaInstanceDocument();
            instance.setId(UUID.randomUUID().toString());
            instance.setTenantId(tenantId);
            instance.setTemplateKey(template.getKey());
            instance.setAutonomyMode(AutonomyMode.REQUIRES_APPROVAL);
            instance.setStatus(PersonaStatus.ACTIVE);
            instance.setSettings(new LinkedHashMap<>());
            instance.setCreatedAt(now);
            instance.setUpdatedAt(now);
            try {
                instanceRepository.insert(instance);
                log.info("Provisioned {} for tenant {}", template.getKey(), tenantId);
            } catch (DuplicateKeyException e) {
                log.debug("Instance of {} for tenant {} was provisioned concurrently", template.getKey(), tenantId);
            }
        }
    }

    public List<PersonaInstanceDto> listInstances(String tenantId) {
        ensureInstancesForTenant(tenantId);
        Map<String, PersonaTemplateDocument> templates = activeTemplates().stream()
                .collect(Collectors.toMap(PersonaTemplateDocument::getKey, t -> t));
        return instanceRepository.findByTenantIdAndStatusNot(tenantId, PersonaStatus.DELETED).stream()
                .filter(i -> templates.containsKey(i.getTemplateKey()))
                .sorted(Comparator.comparing(PersonaInstanceDocument::getTemplateKey))
                .map(i -> toInstanceDto(i, templates.get(i.getTemplateKey())))
                .toList();
    }

    public PersonaInstanceDto updateAutonomyMode(String tenantId, String instanceId, AutonomyMode mode, String role) {
        requireAdmin(role);
        if (mode == null) {
            throw new BadRequestException("autonomyMode is required");
        }
        PersonaInstanceDocument instance = instanceRepository.findByIdAndTenantId(instanceId, tenantId)
                .orElseThrow(() -> new NotFoundException("AI employee instance not found"));
        instance.setAutonomyMode(mode);
        instance.setUpdatedAt(Instant.now());
        PersonaInstanceDocument saved = instanceRepository.save(instance);
        log.info("Instance {} autonomy set to {}", instanceId, mode.wireValue());
        return toInstanceDto(saved, findTemplate(saved.getTemplateKey()).orElse(null));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    public static String displayName(PersonaInstanceDocument instance, PersonaTemplateDocument template) {
        if (instance.getNameOverride() != null && !instance.getNameOverride().isBlank()) {
            return instance.getNameOverride();
        }
        return template != null ? template.getDisplayName() : instance.getTemplateKey();
    }

    public static List<String> allowedTools(PersonaTemplateDocument template) {
        return template == null || template.getAllowedTools() == null ? List.of() : template.getAllowedTools();
    }

    /** Template defaults overlaid with the instance's own settings. */
    public static Map<String, Object> mergedSettings(PersonaTemplateDocument template, PersonaInstanceDocument instance) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (template != null && template.getDefaultSettings() != null) merged.putAll(template.getDefaultSettings());
        if (instance.getSettings() != null) merged.putAll(instance.getSettings());
        return merged;
    }

    private static void requireAdmin(String role) {
        if (role == null || !ADMIN_ROLES.contains(role.trim().toUpperCase(Locale.ROOT))) {
            throw new ForbiddenException("Admin role required to edit personas");
        }
    }

    static PersonaTemplateDto toTemplateDto(PersonaTemplateDocument t) {
        return new PersonaTemplateDto(t.getKey(), t.getDisplayName(), t.getDescription(), t.getSystemPrompt(),
                allowedTools(t), t.getDefaultAutonomyMode(),
                t.getDefaultSettings() == null ? Map.of() : t.getDefaultSettings(), t.isActive());
    }

    static PersonaInstanceDto toInstanceDto(PersonaInstanceDocument i, PersonaTemplateDocument t) {
        return new PersonaInstanceDto(i.getId(), i.getTenantId(), i.getTemplateKey(), displayName(i, t),
                i.getAutonomyMode(), i.getStatus(), allowedTools(t),
                i.getSettings() == null ? Map.of() : i.getSettings(), i.getCreatedAt(), i.getUpdatedAt());
    }
}
