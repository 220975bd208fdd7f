package org.dpg.jobprocessor.service.catalog;

import org.dpg.jobprocessor.common.apiclient.catalog.CatalogApiClient;
import org.dpg.jobprocessor.exception.apiclient.NotFoundException;
import org.dpg.jobprocessor.model.Metadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogMetadataServiceTest {

    private static final String MARC = """
            <?xml version="1.0" encoding="UTF-8"?>
            <collection xmlns="http://www.loc.gov/MARC21/slim">
              <record>
                <datafield tag="245" ind1="1" ind2="0">
                  <subfield code="a">Notes on the state of Virginia</subfield>
                </datafield>
                <datafield tag="260" ind1=" " ind2=" ">
                  <subfield code="a">London :</subfield>
                  <subfield code="c">[1787?]</subfield>
                </datafield>
                <datafield tag="999" ind1=" " ind2=" ">
                  <subfield code="i">X000111</subfield>
                  <subfield code="l">STACKS</subfield>
                </datafield>
                <datafield tag="999" ind1=" " ind2=" ">
                  <subfield code="i">X000222</subfield>
                  <subfield code="l">SPEC-COLL</subfield>
                </datafield>
              </record>
            </collection>
            """;

    @Mock
    private CatalogApiClient catalogApiClient;

    @InjectMocks
    private CatalogMetadataService service;

    @Test
    void publicationYearComesFrom260c() {
        // given
        when(catalogApiClient.fetchMarcXml("u123")).thenReturn(MARC.getBytes(StandardCharsets.UTF_8));

        // when
        final int year = service.publicationYear(metadata("X000111"));

        // then
        assertThat(year).isEqualTo(1787);
    }

    @Test
    void locationMatchesItemBarcode() {
        // given
        when(catalogApiClient.fetchMarcXml("u123")).thenReturn(MARC.getBytes(StandardCharsets.UTF_8));

        // when / then
        assertThat(service.location(metadata("X000222"))).isEqualTo("SPEC-COLL");
    }

    @Test
    void unknownBarcodeHasNoLocation() {
        // given
        when(catalogApiClient.fetchMarcXml("u123")).thenReturn(MARC.getBytes(StandardCharsets.UTF_8));

        // when / then
        assertThat(service.location(metadata("X999999"))).isEmpty();
    }

    @Test
    void unreachableCatalogYieldsUnknownValues() {
        // given
        when(catalogApiClient.fetchMarcXml("u123")).thenThrow(new NotFoundException("no record"));

        // when / then
        assertThat(service.publicationYear(metadata("X000111"))).isZero();
        assertThat(service.location(metadata("X000111"))).isEmpty();
    }

    @Test
    void malformedRecordYieldsUnknownYear() {
        // given
        when(catalogApiClient.fetchMarcXml("u123")).thenReturn("<collection><record>".getBytes(StandardCharsets.UTF_8));

        // when / then
        assertThat(service.publicationYear(metadata("X000111"))).isZero();
    }

    private static Metadata metadata(final String barcode) {
        final Metadata metadata = new Metadata();
        metadata.setId(17L);
        metadata.setPid("u123");
        metadata.setBarcode(barcode);
        return metadata;
    }
}
