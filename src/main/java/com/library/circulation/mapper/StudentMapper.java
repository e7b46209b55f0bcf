package com.library.circulation.mapper;

import com.library.circulation.dto.request.CreateStudentRequest;
import com.library.circulation.dto.request.UpdateStudentRequest;
import com.library.circulation.dto.response.StudentResponse;
import com.library.circulation.entity.Student;

public final class StudentMapper {

    private StudentMapper() {}

    public static Student toEntity(CreateStudentRequest request) {
        Student student = new Student();
        student.setName(request.name());
        student.setAdmissionNumber(request.admissionNumber());
        student.setEmail(request.email());
        student.setClassName(request.className());
        return student;
    }

    public static StudentResponse toResponse(Student student) {
        return new StudentResponse(
            student.getId(),
            student.getName(),
            student.getAdmissionNumber(),
            student.getEmail(),
            student.getClassName(),
            student.isBlacklisted(),
            student.getBlacklistUntil(),
            student.getBlacklistReason(),
            student.getUnblacklistReason(),
            student.getUnblacklistDate(),
            student.getUnblacklistAdminId(),
            student.getCreatedAt(),
            student.getUpdatedAt()
        );
    }

    public static void updateEntity(Student student, UpdateStudentRequest request) {
        if (request.name() != null) {
            student.setName(request.name());
        }
        if (request.admissionNumber() != null) {
            student.setAdmissionNumber(request.admissionNumber());
        }
        if (request.email() != null) {
            student.setEmail(request.email());
        }
        if (request.className() != null) {
            student.setClassName(request.className());
        }
    }
}
