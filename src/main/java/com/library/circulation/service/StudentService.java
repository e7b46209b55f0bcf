package com.library.circulation.service;

import com.library.circulation.dto.request.CreateStudentRequest;
import com.library.circulation.dto.request.UpdateStudentRequest;
import com.library.circulation.dto.response.StudentResponse;
import com.library.circulation.entity.Student;
import com.library.circulation.exception.DuplicateAdmissionNumberException;
import com.library.circulation.exception.LoanHistoryExistsException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.mapper.StudentMapper;
import com.library.circulation.repository.BorrowRecordRepository;
import com.library.circulation.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class StudentService {

    private final StudentRepository studentRepository;
    private final BorrowRecordRepository borrowRecordRepository;

    @Transactional(readOnly = true)
    public Page<StudentResponse> findAll(Boolean blacklisted, Pageable pageable) {
        Page<Student> page = blacklisted == null
            ? studentRepository.findAll(pageable)
            : studentRepository.findAllByBlacklisted(blacklisted, pageable);
        return page.map(StudentMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public StudentResponse findById(Long id) {
        Student student = studentRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Student", id));
        return StudentMapper.toResponse(student);
    }

    @Transactional
    public StudentResponse create(CreateStudentRequest request) {
        if (studentRepository.existsByAdmissionNumber(request.admissionNumber())) {
            throw new DuplicateAdmissionNumberException(request.admissionNumber());
        }
        Student saved = studentRepository.save(StudentMapper.toEntity(request));
        return StudentMapper.toResponse(saved);
    }

    /**
     * Updates contact and class details. Blacklist state is not editable here.
     */
    @Transactional
    public StudentResponse update(Long id, UpdateStudentRequest request) {
        Student student = studentRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Student", id));

        if (request.admissionNumber() != null && !request.admissionNumber().equals(student.getAdmissionNumber())
                && studentRepository.existsByAdmissionNumberAndIdNot(request.admissionNumber(), id)) {
            throw new DuplicateAdmissionNumberException(request.admissionNumber());
        }

        StudentMapper.updateEntity(student, request);
        return StudentMapper.toResponse(studentRepository.save(student));
    }

    @Transactional
    public void delete(Long id) {
        Student student = studentRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Student", id));

        if (borrowRecordRepository.existsByStudentId(id)) {
            throw new LoanHistoryExistsException("Cannot delete a student with borrowing history");
        }

        studentRepository.delete(student);
    }
}
