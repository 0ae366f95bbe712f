package kyc.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import kyc.core.model.PersonalInfo;

public record PersonalInfoDto(
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("email") String email,
        @JsonProperty("phone") String phone,
        @JsonProperty("birthdate") String birthdate,
        @JsonProperty("gender") String gender,
        @JsonProperty("address") String address,
        @JsonProperty("picture") String picture) {

    public static PersonalInfoDto from(PersonalInfo info) {
        return new PersonalInfoDto(
                info.firstName(),
                info.lastName(),
                info.email(),
                info.phone(),
                info.birthdate(),
                info.gender(),
                info.address(),
                info.pictureRef());
    }
}
