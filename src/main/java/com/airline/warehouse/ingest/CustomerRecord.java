package com.airline.warehouse.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class CustomerRecord extends SourceRecord {

    private String customerId;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String loyaltyTier;
    private Integer loyaltyPoints;
    private LocalDate joinDate;
    private String country;
    private String city;

    @Override
    public RecordKind getKind() {
        return RecordKind.CUSTOMER;
    }

    @Override
    public String getRecordKey() {
        return customerId;
    }
}
