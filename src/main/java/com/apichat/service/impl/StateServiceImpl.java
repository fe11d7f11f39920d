package com.apichat.service.impl;

import com.apichat.exception.ApiAgentException;
import com.apichat.model.ApiDocument;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import com.apichat.service.api.StateService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of the {@link StateService} that persists the application's state
 * to a single JSON file.
 * <p>
 * All state is held in memory and written through on every change. Backend credentials are
 * encrypted with a {@link StringEncryptor} before they reach memory or disk. A state file that
 * cannot be parsed is moved aside and the application starts fresh.
 */
@Service
@Slf4j
public class StateServiceImpl implements StateService {

    private final File stateFile;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StringEncryptor encryptor;

    private Map<String, ApiDocument> documents = new ConcurrentHashMap<>();
    private Map<String, Map<String, EndpointOverlay>> overlays = new ConcurrentHashMap<>();
    private Map<String, CompiledAgent> agents = new ConcurrentHashMap<>();
    private Map<String, String> credentials = new ConcurrentHashMap<>();

    /**
     * @param encryptor The Jasypt encryptor provided by the Jasypt Spring Boot starter.
     * @param statePath The location of the state file.
     */
    public StateServiceImpl(StringEncryptor encryptor,
                            @Value("${agent.state.file:${API_CHAT_AGENT_HOME:${user.home}}/.api-chat-agent/state.json}") String statePath) {
        this.encryptor = encryptor;
        this.stateFile = new File(statePath);
    }

    @PostConstruct
    public void init() {
        loadState();
    }

    @Override
    public void saveDocument(ApiDocument document) {
        documents.put(document.id(), document);
        saveState();
    }

    @Override
    public ApiDocument getDocument(String documentId) {
        return documentId == null ? null : documents.get(documentId);
    }

    @Override
    public Collection<ApiDocument> listDocuments() {
        return List.copyOf(documents.values());
    }

    @Override
    public void saveOverlay(String documentId, EndpointOverlay overlay) {
        overlays.computeIfAbsent(documentId, id -> new ConcurrentHashMap<>()).put(overlay.operationKey(), overlay);
        saveState();
    }

    @Override
    public Map<String, EndpointOverlay> getOverlays(String documentId) {
        Map<String, EndpointOverlay> documentOverlays = overlays.get(documentId);
        return documentOverlays == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(documentOverlays));
    }

    @Override
    public void saveAgent(CompiledAgent agent) {
        agents.put(agent.name(), agent);
        saveState();
    }

    @Override
    public CompiledAgent getAgent(String agentName) {
        return agentName == null ? null : agents.get(agentName);
    }

    @Override
    public Collection<CompiledAgent> listAgents() {
        return List.copyOf(agents.values());
    }

    /**
     * {@inheritDoc}
     * <p>
     * The key is encrypted before it is stored in memory and persisted.
     */
    @Override
    public void saveBackendCredential(String provider, String key) {
        log.info("Encrypting and saving credential for backend '{}'", provider);
        credentials.put(normalize(provider), encryptor.encrypt(key));
        saveState();
    }

    /**
     * {@inheritDoc}
     * <p>
     * If decryption fails, which happens when the encryption password changed, an error is
     * logged and {@code null} is returned.
     */
    @Override
    public String getBackendCredential(String provider) {
        String encrypted = provider == null ? null : credentials.get(normalize(provider));
        if (encrypted == null) {
            return null;
        }
        try {
            return encryptor.decrypt(encrypted);
        } catch (Exception e) {
            log.error("Could not decrypt credential for backend '{}'. The encryption password may have changed.", provider);
            return null;
        }
    }

    private static String normalize(String provider) {
        return provider.toLowerCase(Locale.ROOT);
    }

    private synchronized void saveState() {
        try {
            File parentDir = stateFile.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }

            Map<String, Object> state = new LinkedHashMap<>();
            state.put("documents", documents);
            state.put("overlays", overlays);
            state.put("agents", agents);
            state.put("credentials", credentials); // still encrypted
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(stateFile, state);
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save application state to {}", stateFile, e);
            throw new ApiAgentException("Failed to save application state", e);
        }
    }

    private synchronized void loadState() {
        if (!stateFile.exists() || stateFile.length() == 0) {
            log.info("No state file found at {}, starting with a clean state.", stateFile);
            return;
        }
        try {
            Map<String, Object> state = objectMapper.readValue(stateFile, new TypeReference<LinkedHashMap<String, Object>>() {});

            if (state.get("documents") != null) {
                documents = objectMapper.convertValue(state.get("documents"),
                        new TypeReference<ConcurrentHashMap<String, ApiDocument>>() {});
            }
            if (state.get("overlays") != null) {
                overlays = objectMapper.convertValue(state.get("overlays"),
                        new TypeReference<ConcurrentHashMap<String, Map<String, EndpointOverlay>>>() {});
                overlays.replaceAll((id, byKey) -> new ConcurrentHashMap<>(byKey));
            }
            if (state.get("agents") != null) {
                agents = objectMapper.convertValue(state.get("agents"),
                        new TypeReference<ConcurrentHashMap<String, CompiledAgent>>() {});
            }
            if (state.get("credentials") != null) {
                credentials = objectMapper.convertValue(state.get("credentials"),
                        new TypeReference<ConcurrentHashMap<String, String>>() {});
            }
            log.info("Loaded {} documents and {} agents from {}", documents.size(), agents.size(), stateFile);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not load or parse state file at {}. A backup will be created and the application will start with a fresh state. Error: {}",
                    stateFile, e.getMessage());
            backupCorruptedStateFile();
            documents = new ConcurrentHashMap<>();
            overlays = new ConcurrentHashMap<>();
            agents = new ConcurrentHashMap<>();
            credentials = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedStateFile() {
        File backupFile = new File(stateFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(stateFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted state file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted state file from {} to {}",
                    stateFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
