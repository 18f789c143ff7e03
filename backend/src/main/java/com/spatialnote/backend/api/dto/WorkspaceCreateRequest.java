package com.spatialnote.backend.api.dto;

import com.spatialnote.backend.domain.workspace.WorkspaceCategory;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public class WorkspaceCreateRequest {

    @NotBlank
    public String name;

    public String description;

    public WorkspaceCategory category;

    public List<String> tags;

    public boolean template;
}
