package com.defiguard.tool.wallet;

import com.defiguard.tool.ToolArguments;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Arguments for tools that take none. Any supplied key is rejected by the binder. */
@Data
@NoArgsConstructor
public class EmptyArguments implements ToolArguments {}
