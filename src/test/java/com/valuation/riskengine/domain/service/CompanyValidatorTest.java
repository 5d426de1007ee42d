package com.valuation.riskengine.domain.service;

import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.Company;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CompanyValidatorTest {

    @Test
    void validate_shouldAcceptCompleteCompany() {
        Company company = TestFixtures.company();

        assertSame(company, CompanyValidator.validate(company));
    }

    @Test
    void validate_shouldRejectMissingCompany() {
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> CompanyValidator.validate(null));
        assertEquals("company", e.getField());
    }

    @Test
    void validate_shouldRejectNegativeRevenue() {
        Company company = TestFixtures.company().toBuilder().revenue(-1.0).build();

        InvalidInputException e = assertThrows(InvalidInputException.class, () -> CompanyValidator.validate(company));
        assertEquals("revenue", e.getField());
    }

    @Test
    void validate_shouldAcceptNegativeNetIncome() {
        Company company = TestFixtures.company().toBuilder().netIncome(-10.0).build();

        assertDoesNotThrow(() -> CompanyValidator.validate(company));
    }

    @Test
    void validate_shouldRejectPercentageWrittenAsWholeNumber() {
        Company company = TestFixtures.company().toBuilder().growthRate(15.0).build();

        InvalidInputException e = assertThrows(InvalidInputException.class, () -> CompanyValidator.validate(company));
        assertEquals("growthRate", e.getField());
    }

    @Test
    void validate_shouldRejectTaxRateOfOne() {
        Company company = TestFixtures.company().toBuilder().taxRate(1.0).build();

        assertThrows(InvalidInputException.class, () -> CompanyValidator.validate(company));
    }

    @Test
    void validate_shouldRejectMissingStage() {
        Company company = TestFixtures.company().toBuilder().stage(null).build();

        InvalidInputException e = assertThrows(InvalidInputException.class, () -> CompanyValidator.validate(company));
        assertEquals("stage", e.getField());
    }

    @Test
    void validateComparables_shouldRejectNullEntry() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> CompanyValidator.validateComparables(Arrays.asList(TestFixtures.comparables().get(0), null)));
        assertEquals("comparables[1]", e.getField());
    }
}
