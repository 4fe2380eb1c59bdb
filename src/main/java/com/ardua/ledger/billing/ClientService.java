package com.ardua.ledger.billing;

import com.ardua.ledger.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ClientService {

    private final ClientRepository clientRepository;

    @Transactional
    public Client createClient(String name, int paymentTermsDays) {
        if (clientRepository.findByName(name).isPresent()) {
            throw new IllegalArgumentException("Client already exists: " + name);
        }
        Client client = clientRepository.save(Client.create(name, paymentTermsDays));
        log.info("Created client {} '{}' (net {})", client.getId(), name, paymentTermsDays);
        return client;
    }

    @Transactional(readOnly = true)
    public Client getClient(Long clientId) {
        return clientRepository.findById(clientId)
            .orElseThrow(() -> new ResourceNotFoundException("Client", clientId));
    }

    @Transactional(readOnly = true)
    public List<Client> listClients() {
        return clientRepository.findAll(Sort.by("name"));
    }
}
