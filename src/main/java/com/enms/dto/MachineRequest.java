package com.enms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class MachineRequest {

    private String name;
    private String type;

    @Builder.Default
    private boolean active = true;
}
