package com.spatialnote.backend.api.dto;

import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public class WindowCreateRequest {

    @NotNull
    public WindowType windowType;

    // optional; a fresh id is allocated when absent
    @PositiveOrZero
    public Integer id;

    public WindowPosition position;

    public boolean open;
}
