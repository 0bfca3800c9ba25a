package br.fluitax.kardex.repository;

import br.fluitax.common.util.CnpjUtils;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.PartnerKey;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Repository for trading partners (suppliers/customers) registered per company.
 * Data access only - NO business logic here.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PartnerRepository {

    private static final String COLLECTION = "partners";

    private final Firestore firestore;
    private final KardexSettings settings;

    /**
     * Display names keyed by (companyId, partner CNPJ/CPF digits).
     */
    public Map<PartnerKey, String> findNamesByCompanies(List<String> companyIds) {
        Map<PartnerKey, String> names = new HashMap<>();
        if (companyIds == null || companyIds.isEmpty()) {
            return names;
        }

        QuerySnapshot snapshot = FirestoreReads.await(
                firestore.collection(COLLECTION).whereIn("companyId", companyIds).get(),
                settings.getFetchTimeoutSeconds(),
                COLLECTION);

        for (DocumentSnapshot doc : snapshot.getDocuments()) {
            String document = CnpjUtils.normalize(doc.getString("cnpjCpf"));
            String name = doc.getString("name");
            if (document.isEmpty() || name == null || name.isBlank()) {
                continue;
            }
            names.put(new PartnerKey(doc.getString("companyId"), document), name);
        }
        log.debug("Loaded {} partner names for {} companies", names.size(), companyIds.size());
        return names;
    }
}
