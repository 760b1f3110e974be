package com.defiguard.tool.wallet;

import com.defiguard.tool.ToolArguments;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
public class SignMessageArguments implements ToolArguments {

    @NotNull(message = "is required")
    @ToString.Exclude
    private String message;
}
