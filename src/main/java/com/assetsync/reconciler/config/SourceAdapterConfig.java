package com.assetsync.reconciler.config;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.assetsync.reconciler.adapter.SourceAdapter;
import com.assetsync.reconciler.adapter.SourceCollaborator;
import com.assetsync.reconciler.model.enums.SourceType;

/**
 * Configuration for source adapters and collaborators.
 *
 * Registers all available implementations and provides them as maps
 * indexed by SourceType for lookup.
 */
@Configuration
public class SourceAdapterConfig {

    @Bean
    public Map<SourceType, SourceAdapter> sourceAdapters(List<SourceAdapter> adapters) {
        Map<SourceType, SourceAdapter> adapterMap = new EnumMap<>(SourceType.class);

        for (SourceAdapter adapter : adapters) {
            adapterMap.put(adapter.getSourceType(), adapter);
        }

        return adapterMap;
    }

    /**
     * Collaborators for sources that can be pulled. Sources without one are
     * fed through the REST endpoint instead.
     */
    @Bean
    public Map<SourceType, SourceCollaborator> sourceCollaborators(List<SourceCollaborator> collaborators) {
        Map<SourceType, SourceCollaborator> collaboratorMap = new EnumMap<>(SourceType.class);

        for (SourceCollaborator collaborator : collaborators) {
            collaboratorMap.put(collaborator.getSourceType(), collaborator);
        }

        return collaboratorMap;
    }
}
