package com.enms.service;

import com.enms.dto.MachineRequest;
import com.enms.model.Machine;
import com.enms.repository.MachineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class MachineService {

    private final MachineRepository machineRepository;

    /**
     * Create or replace a machine's registry entry.
     */
    @Transactional
    public Machine register(String machineId, MachineRequest request) {
        Machine machine = machineRepository.findById(machineId).orElseGet(() -> Machine.builder().id(machineId).build());
        machine.setName(request.getName());
        machine.setType(request.getType());
        machine.setActive(request.isActive());
        Machine saved = machineRepository.save(machine);
        log.info("Registered machine {} (type={}, active={})", machineId, saved.getType(), saved.isActive());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Machine> listActiveMachines() {
        return machineRepository.findByActiveTrueOrderById();
    }
}
