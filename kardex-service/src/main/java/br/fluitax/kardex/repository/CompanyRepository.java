package br.fluitax.kardex.repository;

import br.fluitax.common.dto.kardex.CompanyDto;
import br.fluitax.kardex.config.KardexSettings;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for companies stored in Firebase.
 * Data access only - NO business logic here.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CompanyRepository {

    private static final String COLLECTION = "companies";

    private final Firestore firestore;
    private final KardexSettings settings;

    public List<CompanyDto> findAll() {
        QuerySnapshot snapshot = FirestoreReads.await(
                firestore.collection(COLLECTION).get(),
                settings.getFetchTimeoutSeconds(),
                COLLECTION);
        List<CompanyDto> companies = snapshot.getDocuments().stream()
                .map(this::documentToDto)
                .toList();
        log.debug("Loaded {} companies", companies.size());
        return companies;
    }

    private CompanyDto documentToDto(DocumentSnapshot doc) {
        return CompanyDto.builder()
                .id(doc.getId())
                .name(doc.getString("name"))
                .cnpj(doc.getString("cnpj"))
                .build();
    }
}
